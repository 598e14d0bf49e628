package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.component.Bootstep;
import com.libragraph.bootstep.core.component.Host;
import com.libragraph.bootstep.core.component.StartStopComponent;

import java.time.Duration;

/** Included only when {@code worker.heartbeat-interval-ms} is set. */
@Bootstep(name = "heartbeat", namespace = WorkerNamespace.NAME, requires = "timer")
public class HeartbeatStep extends StartStopComponent<Heartbeat> {

    public HeartbeatStep(Host parent) {
        super(parent);
    }

    @Override
    public boolean includeIf(Host parent) {
        return enabled() && ((Worker) parent).settings().heartbeatInterval().isPresent();
    }

    @Override
    public Heartbeat create(Host parent) {
        Worker worker = (Worker) parent;
        Duration interval = worker.settings().heartbeatInterval().orElseThrow();
        worker.heartbeat = new Heartbeat(worker.timer, interval, worker::beat);
        return worker.heartbeat;
    }
}
