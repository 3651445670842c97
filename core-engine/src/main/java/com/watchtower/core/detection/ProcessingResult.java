package com.watchtower.core.detection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of running a set of detectors against one packet.
 *
 * <p>
 * Results are available immediately; nothing is persisted until
 * {@link #commitStateUpdates()} is called. Committing is idempotent: each
 * evaluation's staged updates are drained as they are flushed.
 * </p>
 */
public final class ProcessingResult {

    private final List<DetectorResults> detectorResults;
    private final List<PendingCommit> pendingCommits;

    ProcessingResult(List<DetectorResults> detectorResults, List<PendingCommit> pendingCommits) {
        this.detectorResults = List.copyOf(detectorResults);
        this.pendingCommits = new ArrayList<>(pendingCommits);
    }

    /**
     * @return per-detector results, in detector input order; detectors
     *         without results are omitted
     */
    public List<DetectorResults> getDetectorResults() {
        return detectorResults;
    }

    /**
     * @return total number of results across detectors
     */
    public int resultCount() {
        int count = 0;
        for (DetectorResults results : detectorResults) {
            count += results.getResults().size();
        }
        return count;
    }

    /**
     * Commit every evaluation, in detector input order. The first store
     * failure propagates and leaves the remaining evaluations uncommitted.
     *
     * @throws com.watchtower.core.state.StateStoreException if a store is unavailable
     */
    public void commitStateUpdates() {
        for (PendingCommit pending : pendingCommits) {
            pending.handler.commitStateUpdates(pending.evaluation);
        }
    }

    static final class PendingCommit {

        private final DetectorHandler<?> handler;
        private final DetectorEvaluation evaluation;

        PendingCommit(DetectorHandler<?> handler, DetectorEvaluation evaluation) {
            this.handler = Objects.requireNonNull(handler);
            this.evaluation = Objects.requireNonNull(evaluation);
        }
    }
}
