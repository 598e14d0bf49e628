package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.component.Bootstep;
import com.libragraph.bootstep.core.component.Host;
import com.libragraph.bootstep.core.component.StartStopComponent;

@Bootstep(name = "timer", namespace = WorkerNamespace.NAME)
public class TimerStep extends StartStopComponent<ScheduledTimer> {

    public TimerStep(Host parent) {
        super(parent);
    }

    @Override
    public ScheduledTimer create(Host parent) {
        Worker worker = (Worker) parent;
        worker.timer = new ScheduledTimer();
        return worker.timer;
    }
}
