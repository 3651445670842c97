package com.watchtower.core.detection;

import com.watchtower.core.model.DataPacket;
import com.watchtower.core.model.Detector;
import com.watchtower.core.model.DetectorEvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs a list of detectors against one data packet.
 *
 * <p>
 * Detectors are evaluated independently and in input order. A detector
 * whose type has no registered handler contributes nothing. Duplicate group
 * keys within one detector's results are logged and counted but both
 * results are kept.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Thread-safe as long as the registry's handlers are; the returned
 * {@link ProcessingResult} must stay on the calling thread.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorProcessor.class);

    private final DetectorHandlerRegistry registry;
    private final DetectorMetrics metrics;

    public DetectorProcessor(DetectorHandlerRegistry registry, DetectorMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "DetectorHandlerRegistry must not be null");
        this.metrics = Objects.requireNonNull(metrics, "DetectorMetrics must not be null");
    }

    /**
     * Evaluate every detector against the packet.
     *
     * @param packet    the incoming packet; must not be {@code null}
     * @param detectors detectors to run; must not be {@code null}
     * @param <T>       payload type; must match the payload type of every
     *                  resolved handler
     * @return results plus the pending commits
     * @throws com.watchtower.core.state.StateStoreException if state cannot be read
     */
    public <T> ProcessingResult process(DataPacket<T> packet, List<Detector> detectors) {
        Objects.requireNonNull(packet, "DataPacket must not be null");
        Objects.requireNonNull(detectors, "Detectors list must not be null");

        List<DetectorResults> detectorResults = new ArrayList<>();
        List<ProcessingResult.PendingCommit> pendingCommits = new ArrayList<>();

        for (Detector detector : detectors) {
            Optional<DetectorHandler<?>> resolved = registry.resolve(detector);
            if (resolved.isEmpty()) {
                continue;
            }
            DetectorHandler<T> handler = cast(resolved.get());
            DetectorEvaluation evaluation = handler.evaluate(packet);
            pendingCommits.add(new ProcessingResult.PendingCommit(handler, evaluation));

            List<DetectorEvaluationResult> results = evaluation.getResults();
            if (results.isEmpty()) {
                continue;
            }
            checkDuplicateGroupKeys(detector, results);
            detectorResults.add(new DetectorResults(detector, results));
        }

        LOG.debug("Packet from source '{}' produced results for {} of {} detector(s)",
                packet.getSourceId(), detectorResults.size(), detectors.size());
        return new ProcessingResult(detectorResults, pendingCommits);
    }

    private void checkDuplicateGroupKeys(Detector detector, List<DetectorEvaluationResult> results) {
        Set<String> seen = new HashSet<>();
        for (DetectorEvaluationResult result : results) {
            if (!seen.add(result.getGroupKey())) {
                LOG.error("Duplicate detector state group keys found: detector_id={}, group_key={}",
                        detector.getId(), result.getGroupKey());
                metrics.incrementDuplicateGroupKey(detector.getType());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> DetectorHandler<T> cast(DetectorHandler<?> handler) {
        return (DetectorHandler<T>) handler;
    }
}
