package com.libragraph.bootstep.core.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * What a namespace does when a component fails while being closed, stopped or terminated.
 * Either way the namespace still reaches its terminal state and fires its shutdown signal.
 */
public enum ShutdownPolicy {

    /** Abort the remaining shutdown calls and rethrow the failure. */
    PROPAGATE,

    /** Log the failure and carry on with the next component. */
    CONTINUE;

    /** Case-insensitive parse of a configured value. */
    public static ShutdownPolicy parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (ShutdownPolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown shutdown policy '" + value + "', expected one of "
                + Arrays.stream(values())
                        .map(p -> p.name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", ")));
    }
}
