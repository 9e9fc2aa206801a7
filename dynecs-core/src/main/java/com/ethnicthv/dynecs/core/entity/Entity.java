package com.ethnicthv.dynecs.core.entity;

import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.field.FieldType;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Transient view of one entity: the components registered under {@code id} at the time the view was built.
 * <p>
 * Entities are not stored records. A view is reconstructed on every lookup and holds copies of the
 * components, so changes to the store after construction are not reflected here and changes made
 * through the view never reach the store.
 */
public record Entity(long id, Map<String, Component> components) {

    public Entity {
        Objects.requireNonNull(components, "components");
        components = Collections.unmodifiableMap(new HashMap<>(components));
    }

    /**
     * A view with no components. Returned for ids that were never used.
     */
    public static Entity empty(long id) {
        return new Entity(id, Map.of());
    }

    public Optional<Component> getComponent(String name) {
        return Optional.ofNullable(components.get(name));
    }

    public boolean hasComponent(String name) {
        return components.containsKey(name);
    }

    public Set<String> componentNames() {
        return components.keySet();
    }

    public Optional<FieldType> getField(String componentName, String fieldName) {
        Component component = components.get(componentName);
        return component == null ? Optional.empty() : component.get(fieldName);
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    @Override
    public String toString() {
        return "Entity{id=" + id + ", components=" + components + '}';
    }
}
