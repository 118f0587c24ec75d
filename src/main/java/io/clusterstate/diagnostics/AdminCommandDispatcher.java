package io.clusterstate.diagnostics;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.clusterstate.config.Constants.COMMAND_ARG_VALUE;
import static io.clusterstate.config.Constants.COMMAND_DUMP_NETWORK;
import static io.clusterstate.config.Constants.COMMAND_DUMP_NETWORK_DESCRIPTION;

/**
 * Admin command table for the diagnostics served by the aggregator.
 *
 * <p>Commands are registered once at startup. Receiving a command this class
 * does not know means the table and the handler are out of step, which is a
 * wiring bug and fails hard.
 */
@Slf4j
public class AdminCommandDispatcher {

    private final DiagnosticsQueryEngine queryEngine;
    private final Map<String, String> commands = new LinkedHashMap<>();

    public AdminCommandDispatcher(DiagnosticsQueryEngine queryEngine) {
        this.queryEngine = queryEngine;
    }

    public synchronized void registerCommands() {
        if (commands.putIfAbsent(COMMAND_DUMP_NETWORK, COMMAND_DUMP_NETWORK_DESCRIPTION) != null) {
            throw new IllegalStateException("Command already registered: " + COMMAND_DUMP_NETWORK);
        }
        log.info("Registered admin command '{}'", COMMAND_DUMP_NETWORK);
    }

    public synchronized void unregisterCommands() {
        commands.clear();
        log.info("Unregistered admin commands");
    }

    public synchronized Map<String, String> getCommands() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(commands));
    }

    public synchronized boolean isRegistered(String command) {
        return commands.containsKey(command);
    }

    /**
     * Run a registered command.
     *
     * @param command command name
     * @param args    command arguments; {@code value} is the optional threshold in microseconds
     * @throws AssertionError if the command is not one this dispatcher handles
     */
    public NetworkPingReport call(String command, Map<String, ?> args) {
        if (!COMMAND_DUMP_NETWORK.equals(command)) {
            log.error("Admin command '{}' routed to cluster state, registration is broken", command);
            throw new AssertionError("broken admin command registration: " + command);
        }
        return queryEngine.queryTopLatencies(parseThreshold(args.get(COMMAND_ARG_VALUE)));
    }

    /**
     * Threshold argument as a number, or {@code null} to use the configured default.
     */
    static Long parseThreshold(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable threshold '{}', using default", text);
            return null;
        }
    }
}
