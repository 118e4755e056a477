package me.golemcore.relay.adapter.outbound.backend;

import me.golemcore.relay.domain.model.HealthStatus;
import me.golemcore.relay.port.outbound.BackendException;
import me.golemcore.relay.port.outbound.BackendPort;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackendHealthProbeTest {

    @Test
    void shouldQueryHealthOnStartup() {
        BackendPort backendPort = mock(BackendPort.class);
        when(backendPort.health()).thenReturn(CompletableFuture.completedFuture(
                HealthStatus.builder().status("healthy").version("0.1.0").uptimeSeconds(3.0).build()));
        BackendHealthProbe probe = new BackendHealthProbe(backendPort);

        probe.onApplicationReady();

        verify(backendPort).health();
    }

    @Test
    void shouldSwallowUnreachableBackend() {
        BackendPort backendPort = mock(BackendPort.class);
        when(backendPort.health()).thenReturn(CompletableFuture.failedFuture(
                BackendException.transport("Failed to connect to wrapper service", new IOException("refused"))));
        BackendHealthProbe probe = new BackendHealthProbe(backendPort);

        assertDoesNotThrow(() -> probe.check().join());
    }
}
