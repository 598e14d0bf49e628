package com.libragraph.bootstep.core.namespace;

import java.util.List;

/**
 * Thrown when a namespace cannot compute a boot order: a requirement names a component
 * that is not registered in the namespace, or requirements form a cycle.
 * {@link #components()} names the offending components.
 */
public class ResolutionException extends RuntimeException {

    private final List<String> components;

    public ResolutionException(String message, List<String> components, Throwable cause) {
        super(message, cause);
        this.components = List.copyOf(components);
    }

    public ResolutionException(String message, List<String> components) {
        this(message, components, null);
    }

    public List<String> components() {
        return components;
    }
}
