package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.service.AbstractManagedService;

import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool executing tasks. {@link #stop()} drains queued tasks;
 * {@link #terminate()} interrupts running tasks and drops the queue.
 */
public class WorkerPool extends AbstractManagedService {

    private static final long DRAIN_TIMEOUT_SECONDS = 10;

    private final int concurrency;
    private final AtomicInteger threadIds = new AtomicInteger();
    private volatile ThreadPoolExecutor executor;
    private volatile int dropped;

    public WorkerPool(int concurrency) {
        this.concurrency = concurrency;
    }

    @Override
    public String serviceId() {
        return "pool";
    }

    @Override
    protected void doStart() {
        executor = new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "worker-pool-" + threadIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        log.infof("Pool started with %d threads", concurrency);
    }

    @Override
    protected void doStop() throws InterruptedException {
        ThreadPoolExecutor exec = executor;
        if (exec == null) return;
        exec.shutdown();
        if (!exec.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warnf("Pool did not drain within %ds, forcing", DRAIN_TIMEOUT_SECONDS);
            dropped = exec.shutdownNow().size();
        }
    }

    @Override
    protected void doTerminate() throws InterruptedException {
        ThreadPoolExecutor exec = executor;
        if (exec == null) return;
        List<Runnable> pending = exec.shutdownNow();
        dropped = pending.size();
        if (dropped > 0) {
            log.infof("Pool terminated, dropped %d queued tasks", dropped);
        }
        if (!exec.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warnf("Pool threads still running %ds after terminate", DRAIN_TIMEOUT_SECONDS);
        }
    }

    public void execute(Runnable task) {
        if (!isRunning()) {
            throw new IllegalStateException("Pool is not running (state=" + state() + ")");
        }
        executor.execute(task);
    }

    public int concurrency() {
        return concurrency;
    }

    /** Tasks waiting for a free thread. */
    public int queued() {
        ThreadPoolExecutor exec = executor;
        return exec == null ? 0 : exec.getQueue().size();
    }

    /** Tasks discarded by the last forced shutdown. */
    public int dropped() {
        return dropped;
    }
}
