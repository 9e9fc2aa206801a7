package com.ethnicthv.dynecs.core.entity;

import com.ethnicthv.dynecs.core.api.FieldStatus;
import com.ethnicthv.dynecs.core.api.IEntityQuery;
import com.ethnicthv.dynecs.core.api.IEntityStore;
import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.components.ComponentRegistry;
import com.ethnicthv.dynecs.core.field.FieldArithmetic;
import com.ethnicthv.dynecs.core.field.FieldType;
import com.ethnicthv.dynecs.core.field.OverflowPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * EntityStore - in-memory, schema-less entity-component store.
 * <p>
 * Owns the id counter, the creation-ordered list of issued ids and the {@link ComponentRegistry}.
 * Entity views are never stored; they are rebuilt from the registry on each lookup.
 * <p>
 * Single-threaded. Wrap in {@link SynchronizedEntityStore} to share between threads.
 */
public final class EntityStore implements IEntityStore {
    private static final Logger log = LoggerFactory.getLogger(EntityStore.class);

    private final ComponentRegistry registry;
    private final List<Long> entityIds = new ArrayList<>();
    private final OverflowPolicy overflowPolicy;
    private long nextEntityId = 1;

    public EntityStore() {
        this(false, OverflowPolicy.WRAPPING);
    }

    private EntityStore(boolean reverseIndex, OverflowPolicy overflowPolicy) {
        this.registry = new ComponentRegistry(reverseIndex);
        this.overflowPolicy = overflowPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public long addEntity(Map<String, Component> initialComponents) {
        Objects.requireNonNull(initialComponents, "initialComponents");
        // reject bad entries before the counter or the registry change
        for (Map.Entry<String, Component> entry : initialComponents.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "componentName");
            Objects.requireNonNull(entry.getValue(), "component");
        }
        long entityId = nextEntityId++;
        for (Map.Entry<String, Component> entry : initialComponents.entrySet()) {
            attachComponent(entityId, entry.getKey(), entry.getValue());
        }
        entityIds.add(entityId);
        log.debug("Created entity {} with components {}", entityId, initialComponents.keySet());
        return entityId;
    }

    @Override
    public boolean attachComponent(long entityId, String componentName, Component component) {
        Objects.requireNonNull(componentName, "componentName");
        Objects.requireNonNull(component, "component");
        boolean stored = registry.attach(entityId, componentName, component.copy());
        if (!stored) {
            log.trace("Entity {} already has component '{}'; keeping existing value", entityId, componentName);
        }
        return stored;
    }

    @Override
    public Entity getEntity(long entityId) {
        Map<String, Component> components = new HashMap<>();
        registry.forEachComponentOf(entityId, (name, component) -> components.put(name, component.copy()));
        return new Entity(entityId, components);
    }

    @Override
    public List<Entity> getEntitiesWithComponents(List<String> componentNames) {
        return findEntities(componentNames, List.of());
    }

    @Override
    public List<Entity> findEntities(Collection<String> with, Collection<String> without) {
        List<Long> ids = findEntityIds(with, without);
        List<Entity> entities = new ArrayList<>(ids.size());
        for (long id : ids) {
            entities.add(getEntity(id));
        }
        return entities;
    }

    @Override
    public List<Long> findEntityIds(Collection<String> with, Collection<String> without) {
        Objects.requireNonNull(with, "with");
        Objects.requireNonNull(without, "without");

        List<Set<Long>> required = new ArrayList<>(with.size());
        for (String name : with) {
            Set<Long> holders = registry.entitiesIn(Objects.requireNonNull(name, "componentName"));
            if (holders == null) {
                // never registered: nothing can match
                return List.of();
            }
            required.add(holders);
        }
        List<Set<Long>> excluded = new ArrayList<>(without.size());
        for (String name : without) {
            Set<Long> holders = registry.entitiesIn(Objects.requireNonNull(name, "componentName"));
            if (holders != null) {
                excluded.add(holders);
            }
        }

        List<Long> result = new ArrayList<>();
        candidates:
        for (Long id : entityIds) {
            for (Set<Long> holders : required) {
                if (!holders.contains(id)) continue candidates;
            }
            for (Set<Long> holders : excluded) {
                if (holders.contains(id)) continue candidates;
            }
            result.add(id);
        }
        return result;
    }

    @Override
    public boolean updateField(long entityId, String componentName, String fieldName, FieldType value) {
        Objects.requireNonNull(componentName, "componentName");
        Objects.requireNonNull(fieldName, "fieldName");
        Objects.requireNonNull(value, "value");
        Component component = registry.get(entityId, componentName);
        if (component == null) {
            if (log.isDebugEnabled()) {
                log.debug("Cannot update {}.{} on entity {}: {}", componentName, fieldName, entityId,
                        fieldStatus(entityId, componentName, fieldName));
            }
            return false;
        }
        component.set(fieldName, value);
        return true;
    }

    @Override
    public Optional<FieldType> getField(long entityId, String componentName, String fieldName) {
        Objects.requireNonNull(componentName, "componentName");
        Objects.requireNonNull(fieldName, "fieldName");
        Component component = registry.get(entityId, componentName);
        return component == null ? Optional.empty() : component.get(fieldName);
    }

    /**
     * {@inheritDoc}
     *
     * @throws com.ethnicthv.dynecs.core.field.FieldOverflowException if the store uses
     *         {@link OverflowPolicy#STRICT} and an integer sum overflows; the field is left unchanged
     */
    @Override
    public boolean incrementField(long entityId, String componentName, String fieldName, FieldType delta) {
        Objects.requireNonNull(delta, "delta");
        Optional<FieldType> current = getField(entityId, componentName, fieldName);
        if (current.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("Cannot increment {}.{} on entity {}: {}", componentName, fieldName, entityId,
                        fieldStatus(entityId, componentName, fieldName));
            }
            return false;
        }
        FieldType next = FieldArithmetic.combine(current.get(), delta, overflowPolicy);
        return updateField(entityId, componentName, fieldName, next);
    }

    @Override
    public FieldStatus fieldStatus(long entityId, String componentName, String fieldName) {
        Objects.requireNonNull(componentName, "componentName");
        Objects.requireNonNull(fieldName, "fieldName");
        if (!registry.isRegistered(componentName)) {
            return FieldStatus.UNKNOWN_COMPONENT;
        }
        Component component = registry.get(entityId, componentName);
        if (component == null) {
            return FieldStatus.MISSING_COMPONENT;
        }
        return component.hasField(fieldName) ? FieldStatus.PRESENT : FieldStatus.FIELD_UNSET;
    }

    @Override
    public boolean hasComponent(long entityId, String componentName) {
        Objects.requireNonNull(componentName, "componentName");
        return registry.has(entityId, componentName);
    }

    @Override
    public List<Long> getEntityIds() {
        return Collections.unmodifiableList(new ArrayList<>(entityIds));
    }

    @Override
    public int getEntityCount() {
        return entityIds.size();
    }

    @Override
    public Set<String> getComponentNames() {
        return Set.copyOf(registry.names());
    }

    @Override
    public IEntityQuery query() {
        return new EntityQuery(this);
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public boolean hasReverseIndex() {
        return registry.hasReverseIndex();
    }

    public static class Builder {
        private boolean reverseIndex = false;
        private OverflowPolicy overflowPolicy = OverflowPolicy.WRAPPING;

        /**
         * Track entity id -> attached component names so entity lookups do not scan every category.
         */
        public Builder reverseIndex(boolean enabled) {
            this.reverseIndex = enabled;
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy policy) {
            this.overflowPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public EntityStore build() {
            return new EntityStore(reverseIndex, overflowPolicy);
        }
    }
}
