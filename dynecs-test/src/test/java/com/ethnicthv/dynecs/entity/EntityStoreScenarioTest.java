package com.ethnicthv.dynecs.entity;

import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.entity.Entity;
import com.ethnicthv.dynecs.core.entity.EntityStore;
import com.ethnicthv.dynecs.core.field.FieldType;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * One position entity and one bare entity, driven step by step through the public API.
 */
@DisplayName("End-to-end: position entity lifecycle")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class EntityStoreScenarioTest {

    private final EntityStore store = new EntityStore();
    private long e1;
    private long e2;

    @Test
    @Order(1)
    @DisplayName("Create E1 with position {x: 0.0, y: 0.0}")
    void createPositionEntity() {
        Component position = Component.builder().set("x", 0.0).set("y", 0.0).build();
        e1 = store.addEntity(Map.of("position", position));
        assertEquals(1L, e1);
    }

    @Test
    @Order(2)
    @DisplayName("Create E2 with no components")
    void createBareEntity() {
        e2 = store.addEntity(Map.of());
        assertEquals(2L, e2);
    }

    @Test
    @Order(3)
    @DisplayName("Query [position] returns only E1")
    void queryPosition() {
        List<Entity> result = store.getEntitiesWithComponents("position");
        assertEquals(1, result.size());
        assertEquals(e1, result.get(0).id());
        assertEquals(FieldType.of(0.0), result.get(0).getField("position", "y").orElseThrow());
    }

    @Test
    @Order(4)
    @DisplayName("Update position.x to 1.0")
    void updateX() {
        assertTrue(store.updateField(e1, "position", "x", FieldType.of(1.0)));
        assertEquals(FieldType.of(1.0), store.getField(e1, "position", "x").orElseThrow());
    }

    @Test
    @Order(5)
    @DisplayName("Increment position.x by 1.0")
    void incrementX() {
        assertTrue(store.incrementField(e1, "position", "x", FieldType.of(1.0)));
        assertEquals(FieldType.of(2.0), store.getField(e1, "position", "x").orElseThrow());
    }

    @Test
    @Order(6)
    @DisplayName("Empty query returns E1 and E2")
    void queryAll() {
        Set<Long> ids = store.getEntitiesWithComponents().stream().map(Entity::id).collect(Collectors.toSet());
        assertEquals(Set.of(e1, e2), ids);
    }
}
