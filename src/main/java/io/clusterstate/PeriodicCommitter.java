package io.clusterstate;

import io.clusterstate.state.ClusterStateStore;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Flushes ingestion-only deltas into the aggregated map on a fixed delay.
 * Topology changes commit on their own; this covers the stretches between them.
 */
@Slf4j
public class PeriodicCommitter {

    private final ClusterStateStore store;
    private final long intervalSeconds;
    private final ScheduledExecutorService scheduler;
    private volatile boolean isRunning = false;

    public PeriodicCommitter(ClusterStateStore store, long intervalSeconds) {
        this.store = store;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cluster-state-committer");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        log.info("Starting periodic committer with interval {}s", intervalSeconds);
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::commitTick,
                intervalSeconds,
                intervalSeconds,
                TimeUnit.SECONDS
        );
    }

    public void stop() {
        log.info("Stopping periodic committer");
        isRunning = false;
        scheduler.shutdown();
    }

    public boolean isRunning() {
        return isRunning;
    }

    void commitTick() {
        try {
            long version = store.commit();
            log.debug("Periodic commit produced v{}", version);
        } catch (Exception e) {
            // Keep the schedule alive; the next tick retries with whatever is staged
            log.error("Error in periodic commit: {}", e.getMessage(), e);
        }
    }
}
