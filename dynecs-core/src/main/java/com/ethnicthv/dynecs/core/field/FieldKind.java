package com.ethnicthv.dynecs.core.field;

/**
 * Discriminator of a {@link FieldType} value.
 */
public enum FieldKind {
    /** 64-bit signed integer. */
    INTEGER,
    /** 64-bit IEEE-754 floating point. */
    FLOAT
}
