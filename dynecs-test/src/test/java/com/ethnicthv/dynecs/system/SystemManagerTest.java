package com.ethnicthv.dynecs.system;

import com.ethnicthv.dynecs.core.api.IEntityStore;
import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.entity.EntityStore;
import com.ethnicthv.dynecs.core.system.ComponentFilter;
import com.ethnicthv.dynecs.core.system.EntitySystem;
import com.ethnicthv.dynecs.core.system.ISystem;
import com.ethnicthv.dynecs.core.system.SystemManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SystemManagerTest {

    static class RecordingSystem extends EntitySystem {
        final String name;
        final List<String> log;
        final List<Long> seen = new ArrayList<>();

        RecordingSystem(String name, List<String> log, ComponentFilter filter) {
            super(filter);
            this.name = name;
            this.log = log;
        }

        @Override
        public void update(IEntityStore store, List<Long> entityIds, float deltaTime) {
            log.add(name);
            super.update(store, entityIds, deltaTime);
        }

        @Override
        protected void processEntity(IEntityStore store, long entityId, float deltaTime) {
            seen.add(entityId);
        }
    }

    private EntityStore store;
    private SystemManager manager;
    private List<String> log;

    @BeforeEach
    void setUp() {
        store = new EntityStore();
        manager = new SystemManager(store);
        log = new ArrayList<>();
    }

    private long spawn(String... componentNames) {
        long id = store.addEntity(Map.of());
        for (String name : componentNames) {
            store.attachComponent(id, name, Component.builder().set("n", 0L).build());
        }
        return id;
    }

    @Test
    void update_handsEachSystemTheIdsMatchingItsFilter() {
        long a = spawn("position", "velocity");
        long b = spawn("position");
        long c = spawn("position", "velocity", "frozen");

        RecordingSystem moving = manager.registerSystem(new RecordingSystem("moving",
                log, ComponentFilter.with("position", "velocity").without("frozen")));
        RecordingSystem placed = manager.registerSystem(new RecordingSystem("placed",
                log, ComponentFilter.with("position")));

        assertEquals(4L, manager.update(1f));

        assertEquals(List.of(a), moving.seen);
        assertEquals(List.of(a, b, c), placed.seen);
    }

    @Test
    void allFilter_seesEveryCreatedEntity_butNotBareAttachedIds() {
        long a = spawn();
        long b = spawn("tag");
        store.attachComponent(900, "tag", new Component());

        RecordingSystem everything = manager.registerSystem(new RecordingSystem("all", log, ComponentFilter.all()));
        manager.update(1f);

        assertEquals(List.of(a, b), everything.seen);
    }

    @Test
    void unknownComponentInFilter_yieldsNoIds() {
        spawn("position");
        RecordingSystem sys = manager.registerSystem(new RecordingSystem("ghost", log, ComponentFilter.with("ghost")));

        assertEquals(0L, manager.update(1f));
        assertEquals(List.of("ghost"), log);
        assertTrue(sys.seen.isEmpty());
    }

    @Test
    void systems_runInRegistrationOrder_andSeeEarlierAttachments() {
        long id = spawn("position");
        ISystem tagger = new EntitySystem(ComponentFilter.with("position").without("tagged")) {
            @Override
            protected void processEntity(IEntityStore s, long entityId, float deltaTime) {
                log.add("tagger");
                s.attachComponent(entityId, "tagged", new Component());
            }
        };
        manager.registerSystem(tagger);
        RecordingSystem tagged = manager.registerSystem(new RecordingSystem("tagged", log, ComponentFilter.with("tagged")));

        manager.update(1f);
        manager.update(1f);

        assertEquals(List.of("tagger", "tagged", "tagged"), log);
        assertEquals(List.of(id, id), tagged.seen);
        assertEquals(List.of(tagger, tagged), manager.getRegisteredSystems());
    }

    @Test
    void disabledSystem_isSkipped() {
        spawn("position");
        RecordingSystem sys = manager.registerSystem(new RecordingSystem("a", log, ComponentFilter.with("position")));
        sys.setEnabled(false);
        assertEquals(0L, manager.update(1f));
        assertTrue(log.isEmpty());

        sys.setEnabled(true);
        assertEquals(1L, manager.update(1f));
        assertEquals(List.of("a"), log);
    }

    @Test
    void componentFilter_copiesItsNames() {
        ComponentFilter filter = ComponentFilter.with("a", "b").without("c").without("d");
        assertEquals(List.of("a", "b"), filter.required());
        assertEquals(List.of("c", "d"), filter.excluded());
        assertThrows(UnsupportedOperationException.class, () -> filter.required().add("x"));
        assertThrows(NullPointerException.class, () -> ComponentFilter.with("a", null));
    }

    @Test
    void invalidArguments_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SystemManager(null));
        assertThrows(IllegalArgumentException.class, () -> manager.registerSystem(null));
        assertThrows(NullPointerException.class, () -> new RecordingSystem("a", log, null));
    }
}
