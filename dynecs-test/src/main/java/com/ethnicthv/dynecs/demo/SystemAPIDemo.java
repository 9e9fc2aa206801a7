package com.ethnicthv.dynecs.demo;

import com.ethnicthv.dynecs.DynECS;
import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.entity.Entity;

import java.util.Map;
import java.util.Random;

/**
 * Demo running systems through the {@link DynECS} facade.
 */
public class SystemAPIDemo {

    public static void main(String[] args) {
        MovementSystem movement = new MovementSystem();
        DynECS ecs = DynECS.builder()
                .reverseIndex()
                .addSystem(movement)
                .addSystem(new HealthRegenerationSystem())
                .build();

        Random random = new Random(42);
        System.out.println("Creating 1,000 entities...");
        for (int i = 0; i < 1000; i++) {
            Component position = Component.builder()
                    .set("x", random.nextDouble() * 100)
                    .set("y", random.nextDouble() * 100)
                    .build();
            Component velocity = Component.builder()
                    .set("vx", random.nextDouble() * 10)
                    .set("vy", random.nextDouble() * 10)
                    .build();
            Component health = Component.builder()
                    .set("current", 50L)
                    .set("max", 100L)
                    .build();
            // every third entity stands still
            Map<String, Component> components = i % 3 == 0
                    ? Map.of("position", position, "health", health)
                    : Map.of("position", position, "velocity", velocity, "health", health);
            ecs.addEntity(components);
        }

        long handed = 0;
        for (int frame = 0; frame < 10; frame++) {
            handed += ecs.update(1.0f / 60.0f);
        }
        System.out.println("Entity ids handed to systems: " + handed);

        System.out.println("Moving entities: " + ecs.query().with("position", "velocity").count());
        System.out.println("Moves performed: " + movement.getMoved());
        Entity first = ecs.getEntity(1);
        System.out.println("First entity after 10 frames: " + first);
    }
}
