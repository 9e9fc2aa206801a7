package com.ethnicthv.dynecs.core.api;

import com.ethnicthv.dynecs.core.entity.Entity;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fluent filter over the entities of an {@link IEntityStore}.
 * <p>
 * Supports:
 * - with(): entities MUST have these components
 * - without(): entities MUST NOT have these components
 * <p>
 * A {@code with} name that was never registered makes the result empty. A query with no
 * {@code with} names matches every entity created through the store. Result order is
 * unspecified.
 */
public interface IEntityQuery {

    IEntityQuery with(String... componentNames);

    IEntityQuery without(String... componentNames);

    /**
     * Execute the query and materialize matching entity views.
     */
    List<Entity> toList();

    /**
     * Execute the query returning ids only.
     */
    List<Long> ids();

    int count();

    void forEach(Consumer<Entity> consumer);
}
