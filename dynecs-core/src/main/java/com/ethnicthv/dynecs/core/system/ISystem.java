package com.ethnicthv.dynecs.core.system;

import com.ethnicthv.dynecs.core.api.IEntityStore;

import java.util.List;

/**
 * ISystem - a unit of per-tick logic run by {@link SystemManager}.
 * <p>
 * A system declares which entities it cares about through {@link #filter()}. On every update
 * the manager asks the store for the matching ids and hands them over, so a system never
 * queries for its own working set.
 */
public interface ISystem {

    /** Component names the entities handed to {@link #update} must (and must not) hold. */
    ComponentFilter filter();

    /**
     * Process one tick.
     *
     * @param store     the store the ids belong to
     * @param entityIds ids matching {@link #filter()}, in creation order
     * @param deltaTime time in seconds since the last update
     */
    void update(IEntityStore store, List<Long> entityIds, float deltaTime);

    boolean isEnabled();

    /** Disabled systems are skipped by the manager and their filter is not evaluated. */
    void setEnabled(boolean enabled);
}
