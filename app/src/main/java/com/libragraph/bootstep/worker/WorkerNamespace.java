package com.libragraph.bootstep.worker;

import com.libragraph.bootstep.core.config.BootstepConfig;
import com.libragraph.bootstep.core.namespace.Namespace;
import com.libragraph.bootstep.core.registry.ComponentRegistry;

import java.util.List;

/** The {@code worker} namespace; its steps are registered by {@link WorkerSteps}. */
public class WorkerNamespace extends Namespace {

    public static final String NAME = "worker";

    public WorkerNamespace(ComponentRegistry registry, BootstepConfig config) {
        super(NAME, registry, config);
    }

    @Override
    protected List<String> modules() {
        return List.of(WorkerSteps.class.getName());
    }
}
