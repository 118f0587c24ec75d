package io.clusterstate.ingest;

import lombok.Value;

/**
 * Per-report tally of how the partition entries were handled.
 * Report producers are fire-and-forget and never see this.
 */
@Value
public class IngestResult {
    int accepted;
    int rejectedUnknownPool;
    int rejectedStale;
    int rejectedInvalid;

    public int getTotal() {
        return accepted + rejectedUnknownPool + rejectedStale + rejectedInvalid;
    }
}
