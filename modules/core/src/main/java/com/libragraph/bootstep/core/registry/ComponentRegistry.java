package com.libragraph.bootstep.core.registry;

import com.libragraph.bootstep.core.component.Blueprint;
import com.libragraph.bootstep.core.component.Component;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Table of unclaimed blueprints, bucketed by namespace and keyed by step name.
 * <p>
 * Registering a blueprint under an existing {@code namespace.name} replaces the earlier
 * definition in place. {@link #claim(String)} returns a snapshot and leaves the bucket
 * intact, so several namespaces with the same name can be built from it.
 * Thread-safe.
 */
public class ComponentRegistry {

    private static final Logger log = Logger.getLogger(ComponentRegistry.class);

    private static final ComponentRegistry GLOBAL = new ComponentRegistry();

    private final Map<String, Map<String, Blueprint>> unclaimed = new HashMap<>();

    /** The process-wide registry used by namespaces that are not given one. */
    public static ComponentRegistry global() {
        return GLOBAL;
    }

    /**
     * Registers the blueprint read from a component class.
     *
     * @throws com.libragraph.bootstep.core.component.DefinitionException if the class is
     *         concrete but not a valid boot-step
     */
    public Blueprint register(Class<? extends Component<?>> componentClass) {
        return register(Blueprint.of(componentClass));
    }

    /** Registers a concrete blueprint; abstract blueprints are ignored. */
    public synchronized Blueprint register(Blueprint blueprint) {
        if (blueprint.isAbstract()) {
            log.debugf("Skipping abstract blueprint %s", blueprint);
            return blueprint;
        }
        Blueprint previous = unclaimed
                .computeIfAbsent(blueprint.namespace(), k -> new LinkedHashMap<>())
                .put(blueprint.name(), blueprint);
        if (previous != null) {
            log.infof("Replaced component %s: %s -> %s",
                    blueprint.stepName(), previous, blueprint);
        } else {
            log.debugf("Registered component %s", blueprint.stepName());
        }
        return blueprint;
    }

    /** Returns the namespace's blueprints in registration order. */
    public synchronized Map<String, Blueprint> claim(String namespace) {
        Map<String, Blueprint> bucket = unclaimed.get(namespace);
        if (bucket == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(bucket));
    }

    public synchronized boolean unregister(String namespace, String name) {
        Map<String, Blueprint> bucket = unclaimed.get(namespace);
        return bucket != null && bucket.remove(name) != null;
    }

    public synchronized void clear(String namespace) {
        unclaimed.remove(namespace);
    }

    public synchronized Set<String> namespaces() {
        return Collections.unmodifiableSet(new TreeSet<>(unclaimed.keySet()));
    }
}
