package com.libragraph.bootstep.core.service;

import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for {@link ManagedService} implementations. Provides:
 * <ul>
 *   <li>Thread-safe state machine via {@link AtomicReference}</li>
 *   <li>{@link ServiceStateChangedEvent} delivery on every state transition</li>
 *   <li>Idempotent start and stop</li>
 * </ul>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}, and may override
 * {@link #doTerminate()} for a forced shutdown.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    private final List<ServiceStateListener> listeners = new CopyOnWriteArrayList<>();

    protected final Logger log = Logger.getLogger(getClass());

    // -- template methods for subclasses --

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    protected void doTerminate() throws Exception {
        doStop();
    }

    // -- ManagedService contract --

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return; // idempotent
        }

        transition(State.STARTING);
        try {
            doStart();
            transition(State.RUNNING);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        shutdown(false);
    }

    @Override
    public void terminate() throws Exception {
        shutdown(true);
    }

    @Override
    public void fail(Throwable cause) {
        State old = state.get();
        if (old == State.FAILED) {
            return; // already failed
        }
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), old, cause.getMessage());
        transition(State.FAILED);
    }

    public void addListener(ServiceStateListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ServiceStateListener listener) {
        return listeners.remove(listener);
    }

    // -- internals --

    private void shutdown(boolean force) throws Exception {
        if (state.get() == State.STOPPED) {
            return; // idempotent
        }

        transition(State.STOPPING);
        try {
            if (force) {
                doTerminate();
            } else {
                doStop();
            }
            transition(State.STOPPED);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    private void transition(State newState) {
        State old = state.getAndSet(newState);
        log.debugf("Service '%s': %s -> %s", serviceId(), old, newState);
        ServiceStateChangedEvent event = new ServiceStateChangedEvent(
                serviceId(), old, newState, Instant.now());
        for (ServiceStateListener listener : listeners) {
            try {
                listener.onStateChanged(event);
            } catch (RuntimeException e) {
                log.warnf(e, "State listener failed for service '%s'", serviceId());
            }
        }
    }
}
