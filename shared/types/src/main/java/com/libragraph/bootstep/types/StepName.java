package com.libragraph.bootstep.types;

import java.util.Objects;

/**
 * Fully qualified boot-step name: the owning namespace plus the step's own name.
 * Renders as {@code namespace.name}.
 */
public record StepName(String namespace, String name) {

    public StepName {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }

    /**
     * Resolves a declared name against an optional explicit namespace.
     * When {@code namespace} is null or blank the name must use the dotted
     * {@code namespace.name} form, split at the first dot.
     */
    public static StepName resolve(String namespace, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (namespace != null && !namespace.isBlank()) {
            return new StepName(namespace, name);
        }
        int dot = name.indexOf('.');
        if (dot < 0) {
            throw new IllegalArgumentException(
                    "Name '" + name + "' has no namespace; use 'namespace.name' or set a namespace");
        }
        return new StepName(name.substring(0, dot), name.substring(dot + 1));
    }

    /** Parses {@code namespace.name}. */
    public static StepName parse(String qualified) {
        return resolve(null, qualified);
    }

    @Override
    public String toString() {
        return namespace + "." + name;
    }
}
