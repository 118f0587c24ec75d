package io.clusterstate.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.util.concurrent.AtomicDouble;
import io.clusterstate.metrics.MetricsProvider;
import io.clusterstate.models.Digest;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static io.clusterstate.metrics.MetricsConstants.COMMITTED_VERSION_METRIC_NAME;
import static io.clusterstate.metrics.MetricsConstants.COMMIT_LATENCY_METRIC_NAME;

/**
 * Owner of all mutable cluster state: the committed {@link AggregatedMap},
 * the pending {@link VersionedDelta}, the {@link AdmissionFilter} and the
 * auxiliary map blobs.
 *
 * <p>A single exclusive lock guards everything. Public entry points take it
 * for their whole duration; the internal accessors used by the ingestion and
 * topology engines require the caller to hold it already. Nothing done under
 * the lock blocks on I/O.
 *
 * <p>Commits are totally ordered by the lock, and each advances the
 * committed version by exactly one.
 */
@Slf4j
public class ClusterStateStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final MetricsProvider metricsProvider;
    private final AtomicDouble committedVersionGauge;

    private final AggregatedMap aggregatedMap = new AggregatedMap();
    private final AdmissionFilter admissionFilter = new AdmissionFilter();
    private VersionedDelta pendingDelta = new VersionedDelta();

    // Replicated maps and monitor digests, replaced wholesale
    private JsonNode fsMap;
    private JsonNode mgrMap;
    private JsonNode serviceMap;
    private String healthJson;
    private String monStatusJson;

    public ClusterStateStore(MetricsProvider metricsProvider) {
        this(metricsProvider, Clock.systemUTC());
    }

    public ClusterStateStore(MetricsProvider metricsProvider, Clock clock) {
        this.metricsProvider = metricsProvider;
        this.clock = clock;
        this.committedVersionGauge = metricsProvider.gauge(COMMITTED_VERSION_METRIC_NAME, Map.of());
    }

    // ========== LOCKING ==========

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLockedByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * @throws IllegalStateException if the calling thread does not hold the store lock
     */
    public void assertLockHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Cluster state lock must be held by " + Thread.currentThread().getName());
        }
    }

    // ========== LOCKED ACCESSORS ==========

    public AggregatedMap getAggregatedMap() {
        assertLockHeld();
        return aggregatedMap;
    }

    public VersionedDelta getPendingDelta() {
        assertLockHeld();
        return pendingDelta;
    }

    public AdmissionFilter getAdmissionFilter() {
        assertLockHeld();
        return admissionFilter;
    }

    public long currentTimeMillis() {
        return clock.millis();
    }

    /**
     * Stamp the pending delta as the successor of the committed version.
     */
    public void stageNextVersion() {
        assertLockHeld();
        pendingDelta.setStampMillis(clock.millis());
        pendingDelta.setVersion(aggregatedMap.getVersion() + 1);
        log.debug("Staged v{}", pendingDelta.getVersion());
    }

    // ========== COMMIT ==========

    /**
     * Fold the pending delta into the aggregated map and start a fresh delta.
     *
     * @return the newly committed version
     */
    public long commit() {
        lock.lock();
        long startNanos = System.nanoTime();
        try {
            return commitLocked();
        } finally {
            lock.unlock();
            metricsProvider.timer(COMMIT_LATENCY_METRIC_NAME, Map.of())
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * Commit path for callers that already hold the lock.
     */
    public long commitLocked() {
        assertLockHeld();
        stageNextVersion();
        VersionedDelta delta = pendingDelta;

        if (log.isTraceEnabled()) {
            log.trace("Cluster map before v{}: {} nodes, {} partitions", delta.getVersion(),
                aggregatedMap.getNodeStats().size(), aggregatedMap.getPartitionStats().size());
            log.trace("Incremental: {}", delta);
        }

        aggregatedMap.applyDelta(delta);
        pendingDelta = new VersionedDelta();
        committedVersionGauge.set(aggregatedMap.getVersion());

        log.debug("Committed v{} with {} staged changes", aggregatedMap.getVersion(), delta.size());
        return aggregatedMap.getVersion();
    }

    /**
     * Immutable copy of the committed map, safe to hand to other components.
     */
    public ClusterMapSnapshot snapshot() {
        return withLock(() -> aggregatedMap.toSnapshot());
    }

    public long getCommittedVersion() {
        return withLock(() -> aggregatedMap.getVersion());
    }

    // ========== AUXILIARY BLOBS ==========

    public void setFsMap(JsonNode newFsMap) {
        runWithLock(() -> { fsMap = newFsMap; });
    }

    public JsonNode getFsMap() {
        return withLock(() -> fsMap);
    }

    public void setMgrMap(JsonNode newMgrMap) {
        runWithLock(() -> { mgrMap = newMgrMap; });
    }

    public JsonNode getMgrMap() {
        return withLock(() -> mgrMap);
    }

    public void setServiceMap(JsonNode newServiceMap) {
        runWithLock(() -> { serviceMap = newServiceMap; });
    }

    public JsonNode getServiceMap() {
        return withLock(() -> serviceMap);
    }

    public void loadDigest(Digest digest) {
        runWithLock(() -> {
            healthJson = digest.getHealthJson();
            monStatusJson = digest.getMonStatusJson();
        });
    }

    public Digest getDigest() {
        return withLock(() -> new Digest(healthJson, monStatusJson));
    }
}
