package com.libragraph.bootstep.core.net;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.Socket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class SocketTimeoutsTest {

    @AfterEach
    void reset() {
        SocketTimeouts.setDefault(null);
    }

    @Test
    void unsetByDefault() {
        assertThat(SocketTimeouts.getDefault()).isEmpty();
    }

    @Test
    void scopeRestoresPreviousValue() {
        SocketTimeouts.setDefault(Duration.ofSeconds(30));

        try (SocketTimeouts.Scope scope = SocketTimeouts.override(Duration.ofSeconds(5))) {
            assertThat(SocketTimeouts.getDefault()).contains(Duration.ofSeconds(5));
            assertThat(scope.previous()).contains(Duration.ofSeconds(30));
        }

        assertThat(SocketTimeouts.getDefault()).contains(Duration.ofSeconds(30));
    }

    @Test
    void scopeRestoresOnException() {
        assertThatIllegalStateException().isThrownBy(() -> {
            try (SocketTimeouts.Scope ignored = SocketTimeouts.override(Duration.ofSeconds(5))) {
                throw new IllegalStateException("boom");
            }
        });

        assertThat(SocketTimeouts.getDefault()).isEmpty();
    }

    @Test
    void nestedScopesRestoreInReverseOrder() {
        SocketTimeouts.Scope outer = SocketTimeouts.override(Duration.ofSeconds(10));
        SocketTimeouts.Scope inner = SocketTimeouts.override(Duration.ofSeconds(1));

        inner.close();
        assertThat(SocketTimeouts.getDefault()).contains(Duration.ofSeconds(10));
        outer.close();
        assertThat(SocketTimeouts.getDefault()).isEmpty();
    }

    @Test
    void closingTwiceRestoresOnce() {
        SocketTimeouts.Scope scope = SocketTimeouts.override(Duration.ofSeconds(5));
        scope.close();
        SocketTimeouts.setDefault(Duration.ofSeconds(7));

        scope.close();

        assertThat(SocketTimeouts.getDefault()).contains(Duration.ofSeconds(7));
    }

    @Test
    void zeroClearsAndNegativeIsRejected() {
        SocketTimeouts.setDefault(Duration.ZERO);
        assertThat(SocketTimeouts.getDefault()).isEmpty();

        assertThatIllegalArgumentException()
                .isThrownBy(() -> SocketTimeouts.setDefault(Duration.ofSeconds(-1)));
    }

    @Test
    void appliesDefaultToSockets() throws Exception {
        try (Socket socket = new Socket()) {
            SocketTimeouts.applyTo(socket);
            assertThat(socket.getSoTimeout()).isZero();

            SocketTimeouts.setDefault(Duration.ofMillis(2500));
            SocketTimeouts.applyTo(socket);
            assertThat(socket.getSoTimeout()).isEqualTo(2500);
        }
    }

    @Test
    void subMillisecondDefaultIsNotAppliedAsInfinite() throws Exception {
        SocketTimeouts.setDefault(Duration.ofNanos(500));

        try (Socket socket = new Socket()) {
            SocketTimeouts.applyTo(socket);
            assertThat(socket.getSoTimeout()).isEqualTo(1);
        }
    }
}
