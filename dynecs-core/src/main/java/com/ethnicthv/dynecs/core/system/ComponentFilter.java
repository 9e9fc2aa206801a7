package com.ethnicthv.dynecs.core.system;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The component names a system runs over: entities holding every {@code required} name
 * and none of the {@code excluded} ones, as answered by the store's query engine.
 * An empty {@code required} list selects every created entity.
 */
public record ComponentFilter(List<String> required, List<String> excluded) {

    public ComponentFilter {
        required = List.copyOf(required);
        excluded = List.copyOf(excluded);
    }

    public static ComponentFilter with(String... componentNames) {
        return new ComponentFilter(names(componentNames), List.of());
    }

    public static ComponentFilter all() {
        return new ComponentFilter(List.of(), List.of());
    }

    public ComponentFilter without(String... componentNames) {
        List<String> merged = new ArrayList<>(excluded);
        merged.addAll(names(componentNames));
        return new ComponentFilter(required, merged);
    }

    private static List<String> names(String... componentNames) {
        Objects.requireNonNull(componentNames, "componentNames");
        return Arrays.asList(componentNames);
    }
}
