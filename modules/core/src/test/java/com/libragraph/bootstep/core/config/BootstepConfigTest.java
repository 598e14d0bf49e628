package com.libragraph.bootstep.core.config;

import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class BootstepConfigTest {

    private static SmallRyeConfig config(String... keyValues) {
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder();
        for (int i = 0; i < keyValues.length; i += 2) {
            builder.withDefaultValue(keyValues[i], keyValues[i + 1]);
        }
        return builder.build();
    }

    @Test
    void defaultsWhenNothingConfigured() {
        BootstepConfig cfg = BootstepConfig.from(config());

        assertThat(cfg.shutdownSocketTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.shutdownPolicy()).isEqualTo(ShutdownPolicy.PROPAGATE);
        assertThat(cfg).isEqualTo(BootstepConfig.defaults());
    }

    @Test
    void readsConfiguredValues() {
        BootstepConfig cfg = BootstepConfig.from(config(
                BootstepConfig.SOCKET_TIMEOUT_KEY, "1500",
                BootstepConfig.FAILURE_POLICY_KEY, "Continue"));

        assertThat(cfg.shutdownSocketTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(cfg.shutdownPolicy()).isEqualTo(ShutdownPolicy.CONTINUE);
    }

    @Test
    void loadReadsClasspathProperties() {
        BootstepConfig cfg = BootstepConfig.load();

        assertThat(cfg.shutdownSocketTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.shutdownPolicy()).isEqualTo(ShutdownPolicy.PROPAGATE);
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BootstepConfig.from(config(BootstepConfig.SOCKET_TIMEOUT_KEY, "0")))
                .withMessageContaining("> 0");
    }

    @Test
    void rejectsUnknownPolicy() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BootstepConfig.from(config(BootstepConfig.FAILURE_POLICY_KEY, "ignore")))
                .withMessageContaining("propagate, continue");
    }

    @Test
    void policyParsingIsLenient() {
        assertThat(ShutdownPolicy.parse(" propagate ")).isEqualTo(ShutdownPolicy.PROPAGATE);
        assertThat(ShutdownPolicy.parse("CONTINUE")).isEqualTo(ShutdownPolicy.CONTINUE);
        assertThatIllegalArgumentException().isThrownBy(() -> ShutdownPolicy.parse(null));
    }

    @Test
    void withShutdownPolicyKeepsTimeout() {
        BootstepConfig cfg = new BootstepConfig(Duration.ofSeconds(2), ShutdownPolicy.PROPAGATE)
                .withShutdownPolicy(ShutdownPolicy.CONTINUE);

        assertThat(cfg.shutdownSocketTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(cfg.shutdownPolicy()).isEqualTo(ShutdownPolicy.CONTINUE);
    }
}
