package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.service.AbstractManagedService;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** Single-threaded scheduler shared by the worker's periodic jobs. */
public class ScheduledTimer extends AbstractManagedService {

    private volatile ScheduledExecutorService executor;

    @Override
    public String serviceId() {
        return "timer";
    }

    @Override
    protected void doStart() {
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "worker-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    protected void doStop() throws InterruptedException {
        ScheduledExecutorService exec = executor;
        if (exec != null) {
            exec.shutdownNow();
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Timer thread did not exit within 5s");
            }
        }
    }

    public ScheduledFuture<?> every(Duration interval, Runnable job) {
        if (!isRunning()) {
            throw new IllegalStateException("Timer is not running (state=" + state() + ")");
        }
        long ms = interval.toMillis();
        return executor.scheduleAtFixedRate(job, ms, ms, TimeUnit.MILLISECONDS);
    }
}
