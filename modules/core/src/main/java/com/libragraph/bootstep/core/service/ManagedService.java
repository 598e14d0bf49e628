package com.libragraph.bootstep.core.service;

/**
 * Contract for the runtime objects created by
 * {@link com.libragraph.bootstep.core.component.StartStopComponent}s.
 * State transitions are reported as {@link ServiceStateChangedEvent}s.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    /** Forced shutdown, e.g. without draining queued work. Defaults to {@link #stop()}. */
    default void terminate() throws Exception {
        stop();
    }

    void fail(Throwable cause);

    default boolean isRunning() {
        return state() == State.RUNNING;
    }
}
