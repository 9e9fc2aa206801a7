package com.ethnicthv.dynecs.entity;

import com.ethnicthv.dynecs.core.api.IEntityStore;
import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.entity.EntityStore;
import com.ethnicthv.dynecs.core.entity.SynchronizedEntityStore;
import com.ethnicthv.dynecs.core.field.FieldType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Thread safety of the synchronized store")
public class SynchronizedEntityStoreTest {

    @Test
    @DisplayName("Concurrent increments lose no updates")
    void concurrentIncrements_loseNoUpdates() throws InterruptedException {
        SynchronizedEntityStore store = new SynchronizedEntityStore(new EntityStore());
        long id = store.addEntity(Map.of("counter", Component.builder().set("n", 0L).set("f", 0.0).build()));

        int threads = 8;
        int ops = 1000;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger failures = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < ops; i++) {
                            if (!store.incrementField(id, "counter", "n", FieldType.of(1L))) failures.incrementAndGet();
                            if (!store.incrementField(id, "counter", "f", FieldType.of(1L))) failures.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, failures.get());
        assertEquals(FieldType.of((long) threads * ops), store.getField(id, "counter", "n").orElseThrow());
        assertEquals(FieldType.of((double) threads * ops), store.getField(id, "counter", "f").orElseThrow());
    }

    @Test
    @DisplayName("Concurrent creation issues unique, gap-free ids")
    void concurrentCreation_issuesUniqueIds() throws InterruptedException {
        IEntityStore store = new SynchronizedEntityStore(new EntityStore());
        int threads = 6;
        int perThread = 500;
        ConcurrentLinkedQueue<Long> issued = new ConcurrentLinkedQueue<>();
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < perThread; i++) {
                            issued.add(store.addEntity(Map.of("tag", new Component())));
                            // queries interleave with writers
                            store.query().with("tag").count();
                        }
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        int total = threads * perThread;
        Set<Long> unique = new HashSet<>(issued);
        assertEquals(total, unique.size());
        for (long id = 1; id <= total; id++) {
            assertTrue(unique.contains(id), "missing id " + id);
        }
        assertEquals(total, store.getEntitiesWithComponents("tag").size());
    }

    @Test
    void atomically_groupsSeveralOperations() {
        SynchronizedEntityStore store = new SynchronizedEntityStore(new EntityStore());
        long id = store.atomically(s -> {
            long created = s.addEntity(Map.of());
            s.attachComponent(created, "health", Component.builder().set("hp", 10L).build());
            return created;
        });
        assertEquals(List.of("health"), List.copyOf(store.getEntity(id).componentNames()));
        assertEquals(FieldType.of(10L), store.getField(id, "health", "hp").orElseThrow());
    }

    @Test
    void delegatesEveryOperation() {
        SynchronizedEntityStore store = new SynchronizedEntityStore(new EntityStore());
        long id = store.addEntity(Map.of("p", Component.builder().set("x", 1L).build()));
        assertFalse(store.attachComponent(id, "p", new Component()));
        assertTrue(store.hasComponent(id, "p"));
        assertTrue(store.updateField(id, "p", "y", FieldType.of(2L)));
        assertEquals(Set.of("p"), store.getComponentNames());
        assertEquals(List.of(id), store.getEntityIds());
        assertEquals(1, store.getEntityCount());
        assertEquals(1, store.getEntitiesWithComponents(List.of("p")).size());
        assertEquals(List.of(id), store.findEntityIds(List.of("p"), List.of()));
        assertTrue(store.findEntities(List.of("p"), List.of("p")).isEmpty());
    }

    @Test
    void nullDelegate_isRejected() {
        assertThrows(NullPointerException.class, () -> new SynchronizedEntityStore(null));
    }
}
