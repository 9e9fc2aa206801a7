package com.ethnicthv.dynecs;

import com.ethnicthv.dynecs.core.api.FieldStatus;
import com.ethnicthv.dynecs.core.api.IEntityQuery;
import com.ethnicthv.dynecs.core.api.IEntityStore;
import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.entity.Entity;
import com.ethnicthv.dynecs.core.entity.EntityStore;
import com.ethnicthv.dynecs.core.entity.SynchronizedEntityStore;
import com.ethnicthv.dynecs.core.field.FieldType;
import com.ethnicthv.dynecs.core.field.OverflowPolicy;
import com.ethnicthv.dynecs.core.system.GameLoop;
import com.ethnicthv.dynecs.core.system.ISystem;
import com.ethnicthv.dynecs.core.system.SystemManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DynECS - the single entry point (Facade) for the schema-less entity component store.
 * <p>
 * Wraps an {@link IEntityStore} and a {@link SystemManager} into one API.
 * Provides a Builder for fluent initialization.
 */
public final class DynECS {
    private static final Logger log = LoggerFactory.getLogger(DynECS.class);

    private final IEntityStore store;
    private final SystemManager systemManager;

    private DynECS(IEntityStore store, SystemManager systemManager) {
        this.store = store;
        this.systemManager = systemManager;
    }

    public static Builder builder() {
        return new Builder();
    }

    // =================================================================
    // Store API delegates
    // =================================================================

    public long addEntity(Map<String, Component> initialComponents) {
        return store.addEntity(initialComponents);
    }

    /**
     * Create an entity with no components.
     */
    public long addEntity() {
        return store.addEntity(Map.of());
    }

    public boolean attachComponent(long entityId, String componentName, Component component) {
        return store.attachComponent(entityId, componentName, component);
    }

    public Entity getEntity(long entityId) {
        return store.getEntity(entityId);
    }

    public List<Entity> getEntitiesWithComponents(String... componentNames) {
        return store.getEntitiesWithComponents(componentNames);
    }

    public boolean updateField(long entityId, String componentName, String fieldName, FieldType value) {
        return store.updateField(entityId, componentName, fieldName, value);
    }

    public Optional<FieldType> getField(long entityId, String componentName, String fieldName) {
        return store.getField(entityId, componentName, fieldName);
    }

    public boolean incrementField(long entityId, String componentName, String fieldName, FieldType delta) {
        return store.incrementField(entityId, componentName, fieldName, delta);
    }

    public FieldStatus fieldStatus(long entityId, String componentName, String fieldName) {
        return store.fieldStatus(entityId, componentName, fieldName);
    }

    public IEntityQuery query() {
        return store.query();
    }

    public IEntityStore getStore() {
        return store;
    }

    public SystemManager getSystemManager() {
        return systemManager;
    }

    // =================================================================
    // Systems
    // =================================================================

    /**
     * Run every enabled system once, in registration order.
     *
     * @return number of entity ids handed to systems
     */
    public long update(float deltaTime) {
        return systemManager.update(deltaTime);
    }

    /**
     * Create a {@link GameLoop} bound to this instance's systems. Caller runs and stops it.
     */
    public GameLoop createGameLoop(float targetTickRate) {
        return new GameLoop(systemManager, targetTickRate);
    }

    // =================================================================
    // Builder
    // =================================================================

    public static class Builder {
        private final EntityStore.Builder storeBuilder = EntityStore.builder();
        private final List<ISystem> systems = new ArrayList<>();
        private boolean synchronizedAccess = false;

        /**
         * Serialize every store operation under one lock so the store can be shared between threads.
         */
        public Builder synchronizedAccess() {
            this.synchronizedAccess = true;
            return this;
        }

        /**
         * Keep an entity -> component names index for faster entity lookups.
         */
        public Builder reverseIndex() {
            storeBuilder.reverseIndex(true);
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy policy) {
            storeBuilder.overflowPolicy(policy);
            return this;
        }

        /**
         * Add a system; systems run in the order they are added.
         */
        public Builder addSystem(ISystem system) {
            if (system == null) {
                throw new IllegalArgumentException("System cannot be null");
            }
            systems.add(system);
            return this;
        }

        public DynECS build() {
            EntityStore base = storeBuilder.build();
            IEntityStore store = synchronizedAccess ? new SynchronizedEntityStore(base) : base;

            SystemManager sysMgr = new SystemManager(store);
            for (ISystem system : systems) {
                sysMgr.registerSystem(system);
            }

            log.info("DynECS built (synchronized={}, reverseIndex={}, overflow={}, systems={})",
                    synchronizedAccess, base.hasReverseIndex(), base.getOverflowPolicy(), systems.size());
            return new DynECS(store, sysMgr);
        }
    }
}
