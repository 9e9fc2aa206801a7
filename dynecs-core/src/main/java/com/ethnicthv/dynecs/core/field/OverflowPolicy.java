package com.ethnicthv.dynecs.core.field;

/**
 * How integer + integer combination behaves when the sum leaves the {@code long} range.
 * Floating-point sums are never affected: they follow IEEE-754 and may reach infinity.
 */
public enum OverflowPolicy {
    /**
     * Two's-complement wrap-around, the JVM's native {@code long} addition. Default.
     */
    WRAPPING,

    /**
     * Overflow is trapped and reported as {@link FieldOverflowException}.
     */
    STRICT
}
