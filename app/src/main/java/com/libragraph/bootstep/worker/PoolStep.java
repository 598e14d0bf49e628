package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.component.Bootstep;
import com.libragraph.bootstep.core.component.Host;
import com.libragraph.bootstep.core.component.StartStopComponent;

/** Task pool sized by {@code worker.concurrency}. */
@Bootstep(name = "pool", namespace = WorkerNamespace.NAME, requires = "timer")
public class PoolStep extends StartStopComponent<WorkerPool> {

    public PoolStep(Host parent) {
        super(parent);
    }

    @Override
    public WorkerPool create(Host parent) {
        Worker worker = (Worker) parent;
        worker.pool = new WorkerPool(worker.settings().concurrency());
        return worker.pool;
    }

    /** Drops queued tasks instead of draining them. */
    @Override
    public void terminate(Host parent) throws Exception {
        WorkerPool pool = obj();
        if (pool != null) {
            pool.terminate();
        }
    }
}
