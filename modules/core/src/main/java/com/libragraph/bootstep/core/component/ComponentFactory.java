package com.libragraph.bootstep.core.component;

import java.util.Map;

/**
 * Binds a blueprint to a host, producing the component instance.
 */
@FunctionalInterface
public interface ComponentFactory {

    Component<?> bind(Host parent, Map<String, Object> options);
}
