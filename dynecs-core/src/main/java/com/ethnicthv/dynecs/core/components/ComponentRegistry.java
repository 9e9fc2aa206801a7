package com.ethnicthv.dynecs.core.components;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * ComponentRegistry - two-level index of attached components: category name -> entity id -> component.
 * <p>
 * A category comes into existence the first time a component is attached under its name and is
 * never removed. Attachment is first-write-wins per (category, entity).
 * <p>
 * When the reverse index is enabled, the registry additionally tracks entity id -> attached
 * category names, so per-entity lookups cost O(components of that entity) instead of
 * O(registered categories).
 * <p>
 * Not thread-safe; callers serialize access.
 */
public final class ComponentRegistry {
    private final Map<String, Map<Long, Component>> categories = new HashMap<>();
    private final Map<Long, Set<String>> reverseIndex;

    public ComponentRegistry() {
        this(false);
    }

    public ComponentRegistry(boolean reverseIndex) {
        this.reverseIndex = reverseIndex ? new HashMap<>() : null;
    }

    /**
     * Store {@code component} under (name, entityId) unless one is already there.
     *
     * @return true if stored, false if an existing component was kept
     */
    public boolean attach(long entityId, String name, Component component) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(component, "component");
        Map<Long, Component> byEntity = categories.computeIfAbsent(name, n -> new HashMap<>());
        if (byEntity.putIfAbsent(entityId, component) != null) {
            return false;
        }
        if (reverseIndex != null) {
            reverseIndex.computeIfAbsent(entityId, id -> new LinkedHashSet<>()).add(name);
        }
        return true;
    }

    /**
     * Live stored component, or null if the category is unknown or the entity has none under it.
     */
    public Component get(long entityId, String name) {
        Map<Long, Component> byEntity = categories.get(name);
        return byEntity == null ? null : byEntity.get(entityId);
    }

    public boolean isRegistered(String name) {
        return categories.containsKey(name);
    }

    public boolean has(long entityId, String name) {
        return get(entityId, name) != null;
    }

    /**
     * Entity ids holding a component in the given category, or null if the category was never registered.
     */
    public Set<Long> entitiesIn(String name) {
        Map<Long, Component> byEntity = categories.get(name);
        return byEntity == null ? null : Collections.unmodifiableSet(byEntity.keySet());
    }

    /**
     * Visit every live (name, component) pair attached to {@code entityId}.
     */
    public void forEachComponentOf(long entityId, BiConsumer<String, Component> visitor) {
        if (reverseIndex != null) {
            Set<String> names = reverseIndex.get(entityId);
            if (names == null) return;
            for (String name : names) {
                visitor.accept(name, categories.get(name).get(entityId));
            }
            return;
        }
        // full scan over categories
        for (Map.Entry<String, Map<Long, Component>> entry : categories.entrySet()) {
            Component component = entry.getValue().get(entityId);
            if (component != null) {
                visitor.accept(entry.getKey(), component);
            }
        }
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(categories.keySet());
    }

    public int categoryCount() {
        return categories.size();
    }

    public boolean hasReverseIndex() {
        return reverseIndex != null;
    }
}
