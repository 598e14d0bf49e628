package com.libragraph.bootstep.core.registry;

/**
 * A loadable unit of blueprint definitions. Namespaces name modules in
 * {@link com.libragraph.bootstep.core.namespace.Namespace#modules()}; each is loaded by class
 * name, instantiated with its no-arg constructor and asked to register its blueprints
 * before the namespace claims them.
 */
public interface BlueprintModule {

    void register(ComponentRegistry registry);
}
