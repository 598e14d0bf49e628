package com.libragraph.bootstep.core.net;

import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide default timeout for blocking socket operations.
 * <p>
 * Components that open sockets apply it with {@link #applyTo(Socket)}. Namespaces lower it
 * for the duration of a shutdown through {@link #override(Duration)}, so a hung socket call
 * inside a stop cannot block shutdown indefinitely:
 * <pre>{@code
 * try (SocketTimeouts.Scope ignored = SocketTimeouts.override(Duration.ofSeconds(5))) {
 *     ... stop components ...
 * } // previous default restored
 * }</pre>
 * Overrides restore in LIFO order; interleaving scopes from different threads restore
 * whatever value each scope saw when it was opened.
 */
public final class SocketTimeouts {

    private static final Object LOCK = new Object();

    /** Null means no timeout. */
    private static volatile Duration defaultTimeout;

    private SocketTimeouts() {
    }

    public static Optional<Duration> getDefault() {
        return Optional.ofNullable(defaultTimeout);
    }

    /** Sets the default; null or zero clears it. */
    public static void setDefault(Duration timeout) {
        synchronized (LOCK) {
            defaultTimeout = normalize(timeout);
        }
    }

    /** Replaces the default until the returned scope is closed. */
    public static Scope override(Duration timeout) {
        synchronized (LOCK) {
            Duration previous = defaultTimeout;
            defaultTimeout = normalize(timeout);
            return new Scope(previous);
        }
    }

    /** Applies the current default as {@code SO_TIMEOUT}; leaves the socket unchanged if unset. */
    public static void applyTo(Socket socket) throws SocketException {
        Duration timeout = defaultTimeout;
        if (timeout != null) {
            // 0 means no timeout, so sub-millisecond values round up
            socket.setSoTimeout((int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis())));
        }
    }

    private static Duration normalize(Duration timeout) {
        if (timeout == null || timeout.isZero()) return null;
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Socket timeout must be >= 0, got: " + timeout);
        }
        return timeout;
    }

    /** Restores the saved default when closed. Closing twice is harmless. */
    public static final class Scope implements AutoCloseable {

        private final Duration previous;
        private final AtomicBoolean closed = new AtomicBoolean();

        private Scope(Duration previous) {
            this.previous = previous;
        }

        public Optional<Duration> previous() {
            return Optional.ofNullable(previous);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                synchronized (LOCK) {
                    defaultTimeout = previous;
                }
            }
        }
    }
}
