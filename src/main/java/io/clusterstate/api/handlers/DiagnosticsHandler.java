package io.clusterstate.api.handlers;

import io.clusterstate.api.models.responses.ErrorResponse;
import io.clusterstate.diagnostics.AdminCommandDispatcher;
import io.clusterstate.diagnostics.NetworkPingReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

import static io.clusterstate.config.Constants.COMMAND_ARG_VALUE;
import static io.clusterstate.config.Constants.COMMAND_DUMP_NETWORK;

/**
 * REST API handler for aggregator diagnostics.
 *
 * Supported operations:
 * - GET /_mgr/dump_osd_network - heartbeat ping times at or above the default warning threshold
 * - GET /_mgr/dump_osd_network?value=N - ping times at or above N microseconds (0 lists all)
 */
@Slf4j
@RestController
@RequestMapping("/_mgr")
public class DiagnosticsHandler {

    private final AdminCommandDispatcher dispatcher;

    public DiagnosticsHandler(AdminCommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping("/" + COMMAND_DUMP_NETWORK)
    public ResponseEntity<Object> dumpNetwork(
            @RequestParam(value = COMMAND_ARG_VALUE, required = false) String value) {
        try {
            log.info("Dumping network ping times, requested threshold: {}", value);
            Map<String, Object> args = new HashMap<>();
            if (value != null) {
                args.put(COMMAND_ARG_VALUE, value);
            }
            NetworkPingReport report = dispatcher.call(COMMAND_DUMP_NETWORK, args);
            return ResponseEntity.ok(report);
        } catch (Exception e) {
            log.error("Error dumping network ping times: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.commandFailed(COMMAND_DUMP_NETWORK, e.getMessage()));
        }
    }
}
