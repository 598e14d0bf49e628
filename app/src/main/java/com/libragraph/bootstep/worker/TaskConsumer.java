package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.service.AbstractManagedService;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Moves tasks from the worker's inbound queue onto the pool. Started last so the pool
 * and timer are running before the first task is taken, and stopped first.
 */
public class TaskConsumer extends AbstractManagedService {

    private static final long POLL_INTERVAL_MS = 100;

    private final BlockingQueue<Runnable> inbound;
    private final WorkerPool pool;
    private volatile boolean running;
    private Thread thread;

    public TaskConsumer(BlockingQueue<Runnable> inbound, WorkerPool pool) {
        this.inbound = inbound;
        this.pool = pool;
    }

    @Override
    public String serviceId() {
        return "consumer";
    }

    @Override
    protected void doStart() {
        running = true;
        thread = new Thread(this::consumeLoop, "worker-consumer");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    protected void doStop() throws InterruptedException {
        running = false;
        if (thread != null) {
            thread.interrupt();
            thread.join(TimeUnit.SECONDS.toMillis(5));
        }
    }

    private void consumeLoop() {
        while (running) {
            try {
                Runnable task = inbound.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (task != null) {
                    pool.execute(task);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                if (running) {
                    log.error("Unexpected error in consumer loop", e);
                }
            }
        }
        log.debug("Consumer loop exited");
    }
}
