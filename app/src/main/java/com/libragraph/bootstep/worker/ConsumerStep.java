package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.component.Bootstep;
import com.libragraph.bootstep.core.component.Host;
import com.libragraph.bootstep.core.component.StartStopComponent;

/** Pinned last: tasks are only taken once everything else is running. */
@Bootstep(name = "consumer", namespace = WorkerNamespace.NAME, requires = "pool", last = true)
public class ConsumerStep extends StartStopComponent<TaskConsumer> {

    public ConsumerStep(Host parent) {
        super(parent);
    }

    @Override
    public TaskConsumer create(Host parent) {
        Worker worker = (Worker) parent;
        worker.consumer = new TaskConsumer(worker.inbound(), worker.pool);
        return worker.consumer;
    }
}
