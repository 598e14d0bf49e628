package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.service.AbstractManagedService;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/** Emits a heartbeat on the worker's timer at a fixed interval. */
public class Heartbeat extends AbstractManagedService {

    private final ScheduledTimer timer;
    private final Duration interval;
    private final Runnable beat;
    private ScheduledFuture<?> task;

    public Heartbeat(ScheduledTimer timer, Duration interval, Runnable beat) {
        this.timer = timer;
        this.interval = interval;
        this.beat = beat;
    }

    @Override
    public String serviceId() {
        return "heartbeat";
    }

    @Override
    protected void doStart() {
        task = timer.every(interval, beat);
        log.debugf("Heartbeat every %s", interval);
    }

    @Override
    protected void doStop() {
        if (task != null) {
            task.cancel(false);
        }
    }
}
