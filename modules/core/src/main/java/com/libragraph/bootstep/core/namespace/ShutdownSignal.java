package com.libragraph.bootstep.core.namespace;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot completion event. Set at most once; any number of threads may wait on it,
 * blocking via {@link #await()} or asynchronously via {@link #whenSet()}.
 */
public final class ShutdownSignal {

    private final AtomicBoolean fired = new AtomicBoolean();
    private final CountDownLatch latch = new CountDownLatch(1);
    private final CompletableFuture<Void> future = new CompletableFuture<>();

    /** Fires the signal. Returns true only for the call that fired it. */
    public boolean set() {
        if (!fired.compareAndSet(false, true)) {
            return false;
        }
        latch.countDown();
        future.complete(null);
        return true;
    }

    public boolean isSet() {
        return fired.get();
    }

    public void await() throws InterruptedException {
        latch.await();
    }

    /** Returns true if the signal fired within {@code timeout}. */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Completes when the signal fires. Callers cannot complete it themselves. */
    public CompletionStage<Void> whenSet() {
        return future.minimalCompletionStage();
    }
}
