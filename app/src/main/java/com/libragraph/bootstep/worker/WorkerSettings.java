package com.libragraph.bootstep.worker;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.time.Duration;
import java.util.Optional;

/**
 * Worker settings from {@code worker.*} properties.
 *
 * @param heartbeatInterval heartbeats are disabled when empty
 */
public record WorkerSettings(int concurrency, int queueCapacity, Optional<Duration> heartbeatInterval) {

    public WorkerSettings {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("worker.concurrency must be > 0, got: " + concurrency);
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("worker.queue-capacity must be > 0, got: " + queueCapacity);
        }
        heartbeatInterval = heartbeatInterval == null ? Optional.empty() : heartbeatInterval;
    }

    public static WorkerSettings load() {
        return from(ConfigProvider.getConfig());
    }

    public static WorkerSettings from(Config config) {
        return new WorkerSettings(
                config.getOptionalValue("worker.concurrency", Integer.class).orElse(4),
                config.getOptionalValue("worker.queue-capacity", Integer.class).orElse(1000),
                config.getOptionalValue("worker.heartbeat-interval-ms", Long.class)
                        .filter(ms -> ms > 0)
                        .map(Duration::ofMillis));
    }

    public WorkerSettings withHeartbeat(Duration interval) {
        return new WorkerSettings(concurrency, queueCapacity, Optional.ofNullable(interval));
    }
}
