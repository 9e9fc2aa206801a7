package com.ethnicthv.dynecs.demo;

import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.entity.EntityStore;
import com.ethnicthv.dynecs.core.field.FieldType;

import java.util.Map;

/**
 * Demo driving the raw store API: one entity with a position, one without components,
 * then query, update and increment.
 */
public class EntityStoreDemo {

    public static void main(String[] args) {
        EntityStore store = new EntityStore();

        Component position = Component.builder()
                .set("x", 0.0)
                .set("y", 0.0)
                .build();

        long entityId = store.addEntity(Map.of("position", position));
        store.addEntity(Map.of());

        System.out.println(store.getEntity(entityId));
        System.out.println(store.getEntitiesWithComponents("position"));

        store.updateField(entityId, "position", "x", FieldType.of(1.0));
        System.out.println(store.getEntitiesWithComponents("position"));

        store.incrementField(entityId, "position", "x", FieldType.of(1.0));
        System.out.println(store.getEntitiesWithComponents("position"));

        System.out.println(store.getEntitiesWithComponents());
    }
}
