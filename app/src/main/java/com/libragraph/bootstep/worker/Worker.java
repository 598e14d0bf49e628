package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.component.Host;
import com.libragraph.bootstep.core.component.Startable;
import com.libragraph.bootstep.core.config.BootstepConfig;
import com.libragraph.bootstep.core.registry.ComponentRegistry;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A task worker assembled from the {@code worker} boot-steps. The namespace is applied on
 * construction, so the services exist (stopped) once the constructor returns.
 */
public class Worker implements Host {

    private static final Logger log = Logger.getLogger(Worker.class);

    private final WorkerSettings settings;
    private final List<Startable> components = new ArrayList<>();
    private final BlockingQueue<Runnable> inbound;
    private final AtomicLong heartbeats = new AtomicLong();
    private final WorkerNamespace namespace;

    // Set by the steps while the namespace is applied
    ScheduledTimer timer;
    WorkerPool pool;
    Heartbeat heartbeat;
    TaskConsumer consumer;

    public Worker(WorkerSettings settings) {
        this(settings, ComponentRegistry.global(), BootstepConfig.load());
    }

    public Worker(WorkerSettings settings, ComponentRegistry registry, BootstepConfig config) {
        this.settings = settings;
        this.inbound = new LinkedBlockingQueue<>(settings.queueCapacity());
        this.namespace = new WorkerNamespace(registry, config);
        namespace.onStart(() -> log.infof("Worker starting (concurrency=%d)", settings.concurrency()))
                .onStopped(() -> log.infof("Worker stopped, %d tasks left unconsumed", inbound.size()));
        namespace.apply(this);
    }

    public void start() throws Exception {
        namespace.start(this);
    }

    /** Warm shutdown: queued pool work is drained. */
    public void stop() throws Exception {
        namespace.stop(this);
    }

    /** Cold shutdown: queued pool work is dropped. */
    public void terminate() throws Exception {
        namespace.terminate(this);
    }

    public void join() {
        namespace.join();
    }

    public boolean join(Duration timeout) {
        return namespace.join(timeout);
    }

    /**
     * Queues a task for the consumer.
     *
     * @return false if the worker is shutting down or the queue is full
     */
    public boolean submit(Runnable task) {
        if (namespace.state().isShuttingDown()) {
            return false;
        }
        return inbound.offer(task);
    }

    void beat() {
        long n = heartbeats.incrementAndGet();
        log.debugf("Heartbeat #%d (inbound=%d, pooled=%d)", n, inbound.size(), pool.queued());
    }

    @Override
    public List<Startable> components() {
        return components;
    }

    public WorkerSettings settings() {
        return settings;
    }

    public WorkerNamespace namespace() {
        return namespace;
    }

    BlockingQueue<Runnable> inbound() {
        return inbound;
    }

    public long heartbeats() {
        return heartbeats.get();
    }

    public ScheduledTimer timer() {
        return timer;
    }

    public WorkerPool pool() {
        return pool;
    }

    /** Null unless a heartbeat interval is configured. */
    public Heartbeat heartbeat() {
        return heartbeat;
    }

    public TaskConsumer consumer() {
        return consumer;
    }
}
