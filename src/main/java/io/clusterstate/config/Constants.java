package io.clusterstate.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_AGGREGATOR_ID = "cluster-state-aggregator";
    public static final long DEFAULT_COMMIT_INTERVAL_SECONDS = 5L;

    // Slow ping warning defaults. With no explicit warning threshold the
    // diagnostics threshold is grace seconds * ratio, in microseconds.
    public static final long DEFAULT_WARN_ON_SLOW_PING_TIME_MICROS = 0L;
    public static final double DEFAULT_WARN_ON_SLOW_PING_RATIO = 0.05;
    public static final long DEFAULT_HEARTBEAT_GRACE_SECONDS = 20L;
    public static final long MICROS_PER_SECOND = 1_000_000L;

    // Partition state flags
    public static final String STATE_SEPARATOR = "+";
    public static final String STATE_STALE = "stale";

    // Admin commands
    public static final String COMMAND_DUMP_NETWORK = "dump_osd_network";
    public static final String COMMAND_DUMP_NETWORK_DESCRIPTION = "Dump osd heartbeat network ping times";
    public static final String COMMAND_ARG_VALUE = "value";
}
