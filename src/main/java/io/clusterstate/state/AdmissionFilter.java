package io.clusterstate.state;

import com.google.common.collect.ImmutableSet;
import io.clusterstate.models.PartitionId;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Set;

/**
 * Pools that currently exist according to the last topology snapshot.
 * Partition updates for any other pool are refused at ingestion.
 *
 * <p>The pool set is replaced wholesale on every topology change, never merged.
 * Empty until the first topology snapshot arrives.
 */
@Slf4j
public class AdmissionFilter {

    private ImmutableSet<Long> pools = ImmutableSet.of();

    public boolean admits(PartitionId partitionId) {
        return pools.contains(partitionId.getPool());
    }

    public boolean containsPool(long pool) {
        return pools.contains(pool);
    }

    public void replace(Collection<Long> newPools) {
        ImmutableSet<Long> previous = pools;
        pools = ImmutableSet.copyOf(newPools);
        log.debug("Admission filter replaced: {} pools (was {})", pools.size(), previous.size());
    }

    public Set<Long> getPools() {
        return pools;
    }
}
