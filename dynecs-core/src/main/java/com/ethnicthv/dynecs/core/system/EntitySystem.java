package com.ethnicthv.dynecs.core.system;

import com.ethnicthv.dynecs.core.api.IEntityStore;

import java.util.List;
import java.util.Objects;

/**
 * Base class for systems that handle matching entities one at a time.
 * Subclasses supply the filter once and implement {@link #processEntity}.
 */
public abstract class EntitySystem implements ISystem {

    private final ComponentFilter filter;
    private boolean enabled = true;

    protected EntitySystem(ComponentFilter filter) {
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    @Override
    public final ComponentFilter filter() {
        return filter;
    }

    @Override
    public void update(IEntityStore store, List<Long> entityIds, float deltaTime) {
        for (long entityId : entityIds) {
            processEntity(store, entityId, deltaTime);
        }
    }

    protected abstract void processEntity(IEntityStore store, long entityId, float deltaTime);

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
