package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.config.BootstepConfig;
import com.libragraph.bootstep.core.registry.ComponentRegistry;
import com.libragraph.bootstep.core.service.AbstractManagedService;
import com.libragraph.bootstep.core.service.ManagedService;
import com.libragraph.bootstep.types.NamespaceState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;

class WorkerTest {

    private final List<Worker> workers = new ArrayList<>();

    private Worker newWorker(int concurrency, Duration heartbeat) {
        Worker worker = new Worker(new WorkerSettings(concurrency, 100, Optional.ofNullable(heartbeat)),
                new ComponentRegistry(), BootstepConfig.defaults());
        workers.add(worker);
        return worker;
    }

    @AfterEach
    void tearDown() throws Exception {
        for (Worker worker : workers) {
            worker.terminate();
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    // --- Assembly ---

    @Test
    void consumerIsPinnedLastAndHeartbeatSkippedWithoutInterval() {
        Worker worker = newWorker(2, null);

        assertThat(worker.namespace().bootSteps())
                .extracting(c -> c.name())
                .containsExactly("timer", "pool", "heartbeat", "consumer");
        assertThat(worker.heartbeat()).isNull();
        assertThat(worker.components())
                .containsExactlyElementsOf(worker.namespace().components());
        assertThat(worker.components()).hasSize(3);
        assertThat(worker.timer().state()).isEqualTo(ManagedService.State.STOPPED);
    }

    @Test
    void heartbeatIncludedWhenIntervalConfigured() throws Exception {
        Worker worker = newWorker(1, Duration.ofMillis(20));
        assertThat(worker.components()).hasSize(4);

        worker.start();
        waitUntil(() -> worker.heartbeats() >= 2);
        worker.stop();

        assertThat(worker.heartbeat().state()).isEqualTo(ManagedService.State.STOPPED);
    }

    @Test
    void workersShareOneRegistry() {
        ComponentRegistry registry = new ComponentRegistry();
        WorkerSettings settings = new WorkerSettings(1, 10, Optional.empty());
        Worker a = new Worker(settings, registry, BootstepConfig.defaults());
        Worker b = new Worker(settings, registry, BootstepConfig.defaults());
        workers.add(a);
        workers.add(b);

        assertThat(a.pool()).isNotSameAs(b.pool());
        assertThat(registry.claim(WorkerNamespace.NAME)).containsOnlyKeys("timer", "pool", "heartbeat", "consumer");
    }

    // --- Running ---

    @Test
    void processesSubmittedTasks() throws Exception {
        Worker worker = newWorker(2, null);
        worker.start();

        CountDownLatch done = new CountDownLatch(20);
        for (int i = 0; i < 20; i++) {
            assertThat(worker.submit(done::countDown)).isTrue();
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        worker.stop();
        assertThat(worker.join(Duration.ofSeconds(5))).isTrue();
        assertThat(worker.namespace().state()).isEqualTo(NamespaceState.TERMINATE);
        assertThat(worker.pool().state()).isEqualTo(ManagedService.State.STOPPED);
        assertThat(worker.consumer().state()).isEqualTo(ManagedService.State.STOPPED);
    }

    @Test
    void startTwiceIsRejected() throws Exception {
        Worker worker = newWorker(1, null);
        worker.start();

        assertThatThrownBy(worker::start).isInstanceOf(IllegalStateException.class);
    }

    // --- Shutdown ---

    @Test
    void servicesStopInReverseBootOrder() throws Exception {
        Worker worker = newWorker(1, Duration.ofHours(1));
        List<String> stopped = Collections.synchronizedList(new ArrayList<>());
        for (AbstractManagedService service : List.of(
                worker.timer(), worker.pool(), worker.heartbeat(), worker.consumer())) {
            service.addListener(e -> {
                if (e.newState() == ManagedService.State.STOPPED) {
                    stopped.add(e.serviceId());
                }
            });
        }

        worker.start();
        worker.stop();

        assertThat(stopped).containsExactly("consumer", "heartbeat", "pool", "timer");
    }

    @Test
    void stopDrainsQueuedPoolWork() throws Exception {
        Worker worker = newWorker(1, null);
        worker.start();

        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger ran = new AtomicInteger();
        for (int i = 0; i < 5; i++) {
            worker.submit(() -> {
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                ran.incrementAndGet();
            });
        }
        waitUntil(() -> worker.pool().queued() == 4);

        gate.countDown();
        worker.stop();

        assertThat(ran).hasValue(5);
        assertThat(worker.pool().dropped()).isZero();
    }

    @Test
    void terminateDropsQueuedPoolWork() throws Exception {
        Worker worker = newWorker(1, null);
        worker.start();

        CountDownLatch never = new CountDownLatch(1);
        AtomicInteger ran = new AtomicInteger();
        worker.submit(() -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        for (int i = 0; i < 3; i++) {
            worker.submit(ran::incrementAndGet);
        }
        waitUntil(() -> worker.pool().queued() == 3);

        worker.terminate();

        assertThat(worker.pool().dropped()).isEqualTo(3);
        assertThat(ran).hasValue(0);
        assertThat(worker.namespace().state()).isEqualTo(NamespaceState.TERMINATE);
    }

    @Test
    void submitRefusedOnceShutDown() throws Exception {
        Worker worker = newWorker(1, null);
        worker.start();
        worker.stop();

        assertThat(worker.submit(() -> { })).isFalse();
    }

    @Test
    void joinReturnsWhenStoppedFromAnotherThread() throws Exception {
        Worker worker = newWorker(1, null);
        worker.start();

        Thread stopper = new Thread(() -> {
            try {
                Thread.sleep(50);
                worker.stop();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        stopper.start();

        assertThat(worker.join(Duration.ofSeconds(5))).isTrue();
        stopper.join();
    }

    @Test
    void stoppingAnUnstartedWorkerStillSignals() throws Exception {
        Worker worker = newWorker(1, null);

        worker.stop();

        assertThat(worker.join(Duration.ofMillis(100))).isTrue();
        assertThat(worker.pool().state()).isEqualTo(ManagedService.State.STOPPED);
    }
}
