package com.libragraph.bootstep.core.component;

/**
 * Lifecycle calls a namespace drives on its included components.
 * Start runs in boot order; stop and terminate run in reverse boot order.
 */
public interface Startable {

    void start(Host parent) throws Exception;

    void stop(Host parent) throws Exception;

    /** Called before stop or terminate, on every component in the host's list. */
    default void close(Host parent) throws Exception {
    }

    /** Forced shutdown. Defaults to {@link #stop(Host)}. */
    default void terminate(Host parent) throws Exception {
        stop(parent);
    }
}
