package com.libragraph.bootstep.core.namespace;

import com.libragraph.bootstep.core.registry.BlueprintModule;
import com.libragraph.bootstep.core.registry.ComponentRegistry;

/** Loaded by name from {@link Namespace#modules()} in tests. */
public class TestModule implements BlueprintModule {

    @Override
    public void register(ComponentRegistry registry) {
        registry.register(RecordingStep.step("module-step", "module-base").build());
        registry.register(RecordingStep.step("module-base").build());
    }
}
