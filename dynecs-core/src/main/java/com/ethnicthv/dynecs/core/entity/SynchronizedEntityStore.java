package com.ethnicthv.dynecs.core.entity;

import com.ethnicthv.dynecs.core.api.FieldStatus;
import com.ethnicthv.dynecs.core.api.IEntityQuery;
import com.ethnicthv.dynecs.core.api.IEntityStore;
import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.field.FieldType;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Thread-safe decorator serializing every operation of a delegate store under one exclusive lock.
 * <p>
 * Each call, including the read-then-write of {@link #incrementField} and the
 * filter-then-materialize of queries, runs to completion before another thread may observe
 * the store. Use {@link #atomically(Function)} to group several calls into one critical section.
 */
public final class SynchronizedEntityStore implements IEntityStore {
    private final IEntityStore delegate;
    private final ReentrantLock lock = new ReentrantLock();

    public SynchronizedEntityStore(IEntityStore delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Run {@code action} against the underlying store while holding the lock.
     * The store passed to the action must not escape it.
     */
    public <T> T atomically(Function<IEntityStore, T> action) {
        Objects.requireNonNull(action, "action");
        lock.lock();
        try {
            return action.apply(delegate);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long addEntity(Map<String, Component> initialComponents) {
        return atomically(s -> s.addEntity(initialComponents));
    }

    @Override
    public boolean attachComponent(long entityId, String componentName, Component component) {
        return atomically(s -> s.attachComponent(entityId, componentName, component));
    }

    @Override
    public Entity getEntity(long entityId) {
        return atomically(s -> s.getEntity(entityId));
    }

    @Override
    public List<Entity> getEntitiesWithComponents(List<String> componentNames) {
        return atomically(s -> s.getEntitiesWithComponents(componentNames));
    }

    @Override
    public List<Entity> findEntities(Collection<String> with, Collection<String> without) {
        return atomically(s -> s.findEntities(with, without));
    }

    @Override
    public List<Long> findEntityIds(Collection<String> with, Collection<String> without) {
        return atomically(s -> s.findEntityIds(with, without));
    }

    @Override
    public boolean updateField(long entityId, String componentName, String fieldName, FieldType value) {
        return atomically(s -> s.updateField(entityId, componentName, fieldName, value));
    }

    @Override
    public Optional<FieldType> getField(long entityId, String componentName, String fieldName) {
        return atomically(s -> s.getField(entityId, componentName, fieldName));
    }

    @Override
    public boolean incrementField(long entityId, String componentName, String fieldName, FieldType delta) {
        return atomically(s -> s.incrementField(entityId, componentName, fieldName, delta));
    }

    @Override
    public FieldStatus fieldStatus(long entityId, String componentName, String fieldName) {
        return atomically(s -> s.fieldStatus(entityId, componentName, fieldName));
    }

    @Override
    public boolean hasComponent(long entityId, String componentName) {
        return atomically(s -> s.hasComponent(entityId, componentName));
    }

    @Override
    public List<Long> getEntityIds() {
        return atomically(IEntityStore::getEntityIds);
    }

    @Override
    public int getEntityCount() {
        return atomically(IEntityStore::getEntityCount);
    }

    @Override
    public Set<String> getComponentNames() {
        return atomically(IEntityStore::getComponentNames);
    }

    @Override
    public IEntityQuery query() {
        // executes through this wrapper so each terminal op takes the lock once
        return new EntityQuery(this);
    }
}
