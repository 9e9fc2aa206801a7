package com.ethnicthv.dynecs.core.system;

import com.ethnicthv.dynecs.core.api.IEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs registered systems against one store.
 * <p>
 * Systems run in registration order. For each enabled system, {@link #update(float)} evaluates
 * the system's {@link ComponentFilter} against the store at that moment, so a system sees the
 * components attached by the systems that ran before it in the same tick.
 */
public class SystemManager {
    private static final Logger log = LoggerFactory.getLogger(SystemManager.class);

    private final IEntityStore store;
    private final List<ISystem> systems = new ArrayList<>();

    public SystemManager(IEntityStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
    }

    public <T extends ISystem> T registerSystem(T system) {
        if (system == null) {
            throw new IllegalArgumentException("System cannot be null");
        }
        if (system.filter() == null) {
            throw new IllegalArgumentException("System " + system.getClass().getSimpleName() + " has no filter");
        }
        systems.add(system);
        log.debug("Registered system {} over {}", system.getClass().getSimpleName(), system.filter());
        return system;
    }

    /**
     * Snapshot of the registered systems in execution order.
     */
    public List<ISystem> getRegisteredSystems() {
        return List.copyOf(systems);
    }

    /**
     * Run every enabled system once.
     *
     * @return total number of entity ids handed to systems during this tick
     */
    public long update(float deltaTime) {
        long handed = 0;
        for (ISystem system : systems) {
            if (!system.isEnabled()) {
                continue;
            }
            ComponentFilter filter = system.filter();
            List<Long> ids = store.findEntityIds(filter.required(), filter.excluded());
            system.update(store, ids, deltaTime);
            handed += ids.size();
            log.trace("{} processed {} entities", system.getClass().getSimpleName(), ids.size());
        }
        return handed;
    }

    public IEntityStore getStore() {
        return store;
    }
}
