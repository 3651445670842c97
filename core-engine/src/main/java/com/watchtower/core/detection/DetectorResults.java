package com.watchtower.core.detection;

import com.watchtower.core.model.Detector;
import com.watchtower.core.model.DetectorEvaluationResult;

import java.util.List;
import java.util.Objects;

/**
 * Non-empty results of one detector for one packet.
 */
public final class DetectorResults {

    private final Detector detector;
    private final List<DetectorEvaluationResult> results;

    public DetectorResults(Detector detector, List<DetectorEvaluationResult> results) {
        this.detector = Objects.requireNonNull(detector, "Detector must not be null");
        this.results = List.copyOf(Objects.requireNonNull(results, "results must not be null"));
    }

    public Detector getDetector() {
        return detector;
    }

    public List<DetectorEvaluationResult> getResults() {
        return results;
    }

    @Override
    public String toString() {
        return "DetectorResults{detector=" + detector.getId() + ", results=" + results + '}';
    }
}
