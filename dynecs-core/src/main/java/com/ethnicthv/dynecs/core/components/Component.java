package com.ethnicthv.dynecs.core.components;

import com.ethnicthv.dynecs.core.field.FieldType;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Component - a named bag of numeric fields.
 * <p>
 * Field names are unique per component; iteration order carries no meaning.
 * A component is identified by the name it is attached under, not by a Java type,
 * so the set of component kinds is open and defined at runtime.
 * <p>
 * Instances are mutable and not thread-safe. The store keeps its own copy of every
 * attached component and hands out copies in {@link com.ethnicthv.dynecs.core.entity.Entity} views.
 */
public final class Component {
    private final Map<String, FieldType> fields;

    public Component() {
        this.fields = new HashMap<>();
    }

    private Component(Map<String, FieldType> fields) {
        this.fields = new HashMap<>(fields);
    }

    /**
     * Create a component holding a copy of the given fields.
     */
    public static Component of(Map<String, ? extends FieldType> fields) {
        Objects.requireNonNull(fields, "fields");
        Component component = new Component();
        fields.forEach(component::set);
        return component;
    }

    /**
     * Create a builder for fluent API
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the value of a field, or empty if the field was never written.
     */
    public Optional<FieldType> get(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Insert or overwrite a field.
     *
     * @return the previous value, or null if the field was unset
     */
    public FieldType set(String fieldName, FieldType value) {
        Objects.requireNonNull(fieldName, "fieldName");
        Objects.requireNonNull(value, "value");
        return fields.put(fieldName, value);
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public Set<String> fieldNames() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    /**
     * Read-only view of all fields.
     */
    public Map<String, FieldType> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Deep copy. Field values are immutable, so copying the map is enough.
     */
    public Component copy() {
        return new Component(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Component that = (Component) o;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Component{fields=" + fields + '}';
    }

    public static class Builder {
        private final Map<String, FieldType> fields = new HashMap<>();

        public Builder set(String fieldName, FieldType value) {
            Objects.requireNonNull(fieldName, "fieldName");
            Objects.requireNonNull(value, "value");
            fields.put(fieldName, value);
            return this;
        }

        public Builder set(String fieldName, long value) {
            return set(fieldName, FieldType.of(value));
        }

        public Builder set(String fieldName, double value) {
            return set(fieldName, FieldType.of(value));
        }

        public Component build() {
            return new Component(fields);
        }
    }
}
