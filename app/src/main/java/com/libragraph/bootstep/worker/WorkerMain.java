package com.libragraph.bootstep.worker;

import org.jboss.logging.Logger;

import java.time.Duration;

/** Runs a worker until the JVM is asked to exit. */
public final class WorkerMain {

    private static final Logger log = Logger.getLogger(WorkerMain.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private WorkerMain() {
    }

    public static void main(String[] args) throws Exception {
        Worker worker = new Worker(WorkerSettings.load());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            try {
                worker.terminate();
            } catch (Exception e) {
                log.error("Worker did not terminate cleanly", e);
            }
            if (!worker.join(SHUTDOWN_GRACE)) {
                log.warnf("Worker still running after %s", SHUTDOWN_GRACE);
            }
        }, "worker-shutdown"));

        try {
            worker.start();
        } catch (Exception e) {
            log.error("Worker failed to start", e);
            worker.terminate();
            throw e;
        }
        worker.join();
    }
}
