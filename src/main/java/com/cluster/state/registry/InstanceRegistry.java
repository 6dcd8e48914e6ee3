package com.cluster.state.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks open state instances. Instances register when opened and unregister
 * when closed, so whatever is still registered at shutdown was leaked.
 */
public class InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    private final Set<AutoCloseable> instances = ConcurrentHashMap.newKeySet();

    public void register(AutoCloseable instance) {
        if (instance != null && instances.add(instance)) {
            log.debug("Registered {} ({} open)", instance, instances.size());
        }
    }

    /**
     * Returns whether the instance was registered.
     */
    public boolean unregister(AutoCloseable instance) {
        boolean removed = instance != null && instances.remove(instance);
        if (removed) {
            log.debug("Unregistered {} ({} open)", instance, instances.size());
        }
        return removed;
    }

    public boolean contains(AutoCloseable instance) {
        return instances.contains(instance);
    }

    public int size() {
        return instances.size();
    }

    public List<AutoCloseable> instances() {
        return List.copyOf(instances);
    }

    /**
     * Closes every instance still registered.
     *
     * @return the number of instances closed
     */
    public int closeAll() {
        int closed = 0;
        for (AutoCloseable instance : instances()) {
            try {
                instance.close();
                closed++;
            } catch (Exception e) {
                log.warn("Error closing {}", instance, e);
            }
            instances.remove(instance);
        }
        if (closed > 0) {
            log.info("Closed {} leftover instance(s)", closed);
        }
        return closed;
    }
}
