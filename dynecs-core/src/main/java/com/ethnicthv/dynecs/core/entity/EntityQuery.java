package com.ethnicthv.dynecs.core.entity;

import com.ethnicthv.dynecs.core.api.IEntityQuery;
import com.ethnicthv.dynecs.core.api.IEntityStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Default {@link IEntityQuery}: collects component names and delegates execution to
 * {@link IEntityStore#findEntities} / {@link IEntityStore#findEntityIds}, so each terminal
 * operation is a single store call.
 */
public final class EntityQuery implements IEntityQuery {
    private final IEntityStore store;
    private final List<String> with = new ArrayList<>();
    private final List<String> without = new ArrayList<>();

    public EntityQuery(IEntityStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public EntityQuery with(String... componentNames) {
        for (String name : componentNames) {
            with.add(Objects.requireNonNull(name, "componentName"));
        }
        return this;
    }

    @Override
    public EntityQuery without(String... componentNames) {
        for (String name : componentNames) {
            without.add(Objects.requireNonNull(name, "componentName"));
        }
        return this;
    }

    @Override
    public List<Entity> toList() {
        return store.findEntities(with, without);
    }

    @Override
    public List<Long> ids() {
        return store.findEntityIds(with, without);
    }

    @Override
    public int count() {
        return ids().size();
    }

    @Override
    public void forEach(Consumer<Entity> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        toList().forEach(consumer);
    }

    @Override
    public String toString() {
        return "EntityQuery{with=" + with + ", without=" + without + '}';
    }
}
