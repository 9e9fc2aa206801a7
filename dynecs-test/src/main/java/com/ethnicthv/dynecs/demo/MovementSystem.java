package com.ethnicthv.dynecs.demo;

import com.ethnicthv.dynecs.core.api.IEntityStore;
import com.ethnicthv.dynecs.core.field.FieldType;
import com.ethnicthv.dynecs.core.system.ComponentFilter;
import com.ethnicthv.dynecs.core.system.EntitySystem;

/**
 * Moves every entity carrying both "position" and "velocity" by velocity * deltaTime.
 */
public class MovementSystem extends EntitySystem {
    private long moved;

    public MovementSystem() {
        super(ComponentFilter.with("position", "velocity"));
    }

    @Override
    protected void processEntity(IEntityStore store, long entityId, float deltaTime) {
        double vx = store.getField(entityId, "velocity", "vx").map(FieldType::asDouble).orElse(0.0);
        double vy = store.getField(entityId, "velocity", "vy").map(FieldType::asDouble).orElse(0.0);
        store.incrementField(entityId, "position", "x", FieldType.of(vx * deltaTime));
        store.incrementField(entityId, "position", "y", FieldType.of(vy * deltaTime));
        moved++;
    }

    /**
     * Number of entity moves performed so far.
     */
    public long getMoved() {
        return moved;
    }
}
