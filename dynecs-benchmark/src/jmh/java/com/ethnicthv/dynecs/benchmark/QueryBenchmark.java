package com.ethnicthv.dynecs.benchmark;

import com.ethnicthv.dynecs.core.components.Component;
import com.ethnicthv.dynecs.core.entity.EntityStore;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Component-intersection queries and entity materialization, with and without the reverse index.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
public class QueryBenchmark {

    @Param({"1000", "10000"})
    public int entities;

    @Param({"false", "true"})
    public boolean reverseIndex;

    // extra categories make the per-entity scan more expensive
    @Param({"4", "64"})
    public int categories;

    EntityStore store;

    @Setup
    public void setup() {
        store = EntityStore.builder().reverseIndex(reverseIndex).build();
        Component pos = Component.builder().set("x", 0.0).set("y", 0.0).build();
        Component tag = Component.builder().set("team", 1L).build();
        for (int i = 0; i < entities; i++) {
            Map<String, Component> components = new HashMap<>();
            components.put("position", pos);
            if ((i & 1) == 0) components.put("tag", tag);
            components.put("extra" + (i % categories), tag);
            store.addEntity(components);
        }
    }

    @Benchmark
    public int countPositionAndTag() {
        return store.query().with("position", "tag").count();
    }

    @Benchmark
    public void materializePositionAndTag(Blackhole bh) {
        bh.consume(store.getEntitiesWithComponents("position", "tag"));
    }

    @Benchmark
    public void materializeAll(Blackhole bh) {
        bh.consume(store.getEntitiesWithComponents());
    }
}
