package com.ethnicthv.dynecs.core.api;

/**
 * Outcome of resolving an (entity, component, field) triple.
 * All non-{@link #PRESENT} values are expected conditions, not errors.
 */
public enum FieldStatus {
    /** The field is set. */
    PRESENT,
    /** No entity ever had a component under this name. */
    UNKNOWN_COMPONENT,
    /** The component name is known but the entity has no component under it. */
    MISSING_COMPONENT,
    /** The component exists but the field was never written. */
    FIELD_UNSET
}
