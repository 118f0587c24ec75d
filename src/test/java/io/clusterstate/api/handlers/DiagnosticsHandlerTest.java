package io.clusterstate.api.handlers;

import io.clusterstate.api.models.responses.ErrorResponse;
import io.clusterstate.diagnostics.AdminCommandDispatcher;
import io.clusterstate.diagnostics.NetworkPingReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiagnosticsHandlerTest {

    @Mock
    private AdminCommandDispatcher dispatcher;

    @InjectMocks
    private DiagnosticsHandler diagnosticsHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testDumpNetwork_Success() {
        // Given
        NetworkPingReport report = new NetworkPingReport(100L, Collections.emptyList());
        when(dispatcher.call(eq("dump_osd_network"), anyMap())).thenReturn(report);

        // When
        ResponseEntity<Object> response = diagnosticsHandler.dumpNetwork("100");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(report);
        verify(dispatcher).call("dump_osd_network", Map.of("value", "100"));
    }

    @Test
    void testDumpNetwork_NoThreshold() {
        // Given
        when(dispatcher.call(eq("dump_osd_network"), anyMap()))
            .thenReturn(new NetworkPingReport(0L, Collections.emptyList()));

        // When
        ResponseEntity<Object> response = diagnosticsHandler.dumpNetwork(null);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        verify(dispatcher).call("dump_osd_network", Map.of());
    }

    @Test
    void testDumpNetwork_InternalError() {
        // Given
        when(dispatcher.call(eq("dump_osd_network"), anyMap()))
            .thenThrow(new IllegalStateException("lock interrupted"));

        // When
        ResponseEntity<Object> response = diagnosticsHandler.dumpNetwork("5");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isInstanceOf(ErrorResponse.class);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getError()).isEqualTo("admin_command_exception");
        assertThat(error.getCommand()).isEqualTo("dump_osd_network");
        assertThat(error.getStatus()).isEqualTo(500);
        assertThat(error.getReason()).isEqualTo("lock interrupted");
    }
}
