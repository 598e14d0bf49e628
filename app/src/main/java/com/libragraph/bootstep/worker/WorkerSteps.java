package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.registry.BlueprintModule;
import com.libragraph.bootstep.core.registry.ComponentRegistry;

/** Registers the worker's boot-steps. Registration order breaks ordering ties. */
public class WorkerSteps implements BlueprintModule {

    @Override
    public void register(ComponentRegistry registry) {
        registry.register(TimerStep.class);
        registry.register(PoolStep.class);
        registry.register(HeartbeatStep.class);
        registry.register(ConsumerStep.class);
    }
}
