package com.ethnicthv.dynecs.benchmark;

import com.ethnicthv.dynecs.core.api.IEntityStore;
import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.entity.EntityStore;
import com.ethnicthv.dynecs.core.entity.SynchronizedEntityStore;
import com.ethnicthv.dynecs.core.field.FieldType;
import org.openjdk.jmh.annotations.*;

import java.util.Map;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
public class FieldIncrementBenchmark {

    private static final FieldType ONE_FLOAT = FieldType.of(1.0);
    private static final FieldType ONE_INT = FieldType.of(1L);

    @Param({"false", "true"})
    public boolean synchronizedAccess;

    IEntityStore store;
    long entityId;

    @Setup
    public void setup() {
        EntityStore base = new EntityStore();
        store = synchronizedAccess ? new SynchronizedEntityStore(base) : base;
        entityId = store.addEntity(Map.of("stats", Component.builder().set("hp", 0L).set("speed", 0.0).build()));
    }

    @Benchmark
    public boolean incrementInteger() {
        return store.incrementField(entityId, "stats", "hp", ONE_INT);
    }

    @Benchmark
    public boolean incrementFloatByInteger() {
        return store.incrementField(entityId, "stats", "speed", ONE_INT);
    }

    @Benchmark
    public boolean incrementFloat() {
        return store.incrementField(entityId, "stats", "speed", ONE_FLOAT);
    }

    @Benchmark
    public boolean updateField() {
        return store.updateField(entityId, "stats", "speed", ONE_FLOAT);
    }
}
