package com.ethnicthv.dynecs.demo;

import com.ethnicthv.dynecs.core.api.IEntityStore;
import com.ethnicthv.dynecs.core.field.FieldType;
import com.ethnicthv.dynecs.core.system.ComponentFilter;
import com.ethnicthv.dynecs.core.system.EntitySystem;

/**
 * Regenerates integer "health.current" toward "health.max", one point per tick.
 * Entities flagged with a "dead" component are skipped.
 */
public class HealthRegenerationSystem extends EntitySystem {

    public HealthRegenerationSystem() {
        super(ComponentFilter.with("health").without("dead"));
    }

    @Override
    protected void processEntity(IEntityStore store, long entityId, float deltaTime) {
        long current = store.getField(entityId, "health", "current").map(FieldType::asLong).orElse(0L);
        long max = store.getField(entityId, "health", "max").map(FieldType::asLong).orElse(current);
        if (current < max) {
            store.incrementField(entityId, "health", "current", FieldType.of(1L));
        }
    }
}
