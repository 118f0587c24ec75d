package io.clusterstate.metrics;

/**
 * Constants for metrics names and tags used by the cluster state aggregator.
 */
public class MetricsConstants {
    public final static String PARTITION_UPDATES_METRIC_NAME = "partition_stat_updates";
    public final static String NODE_REPORTS_METRIC_NAME = "node_reports_ingested";
    public final static String COMMIT_LATENCY_METRIC_NAME = "cluster_map_commit_latency";
    public final static String COMMITTED_VERSION_METRIC_NAME = "cluster_map_version";
    public final static String STALE_MARKED_PARTITIONS_METRIC_NAME = "partitions_marked_stale";
    public final static String OUTCOME_TAG = "outcome";
    public final static String OUTCOME_ACCEPTED = "accepted";
    public final static String OUTCOME_UNKNOWN_POOL = "unknown_pool";
    public final static String OUTCOME_STALE = "stale";
    public final static String OUTCOME_INVALID = "invalid";

    private MetricsConstants() {}
}
