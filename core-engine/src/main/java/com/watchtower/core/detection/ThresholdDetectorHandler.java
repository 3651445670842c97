package com.watchtower.core.detection;

import com.watchtower.core.model.DataPacket;
import com.watchtower.core.model.Detector;
import com.watchtower.core.model.DetectorEvaluationResult;
import com.watchtower.core.model.DetectorPriorityLevel;
import com.watchtower.core.model.MetricUpdate;
import com.watchtower.core.state.StateUpdates;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stateless handler (detector type {@value #TYPE}): reports every group key
 * whose value trips a condition, on every packet.
 * <p>
 * No state is read or staged, so there is no deduplication and commit does
 * nothing. A detector without a condition group never reports.
 * </p>
 */
public class ThresholdDetectorHandler extends AbstractDetectorHandler<MetricUpdate> {

    public static final String TYPE = "threshold";

    public ThresholdDetectorHandler(Detector detector, DetectorHandlerContext context) {
        super(detector, context);
    }

    @Override
    public DetectorEvaluation evaluate(DataPacket<MetricUpdate> packet) {
        Objects.requireNonNull(packet, "DataPacket must not be null");
        List<DetectorEvaluationResult> results = new ArrayList<>();
        StateUpdates updates = new StateUpdates(detector.getId());

        if (getConditionGroup().isEmpty()) {
            context.getMetrics().incrementSkippedInvalidConditionGroup(detector.getType());
            return new DetectorEvaluation(results, updates);
        }

        for (Map.Entry<String, Double> entry : MetricDetectorHandler.extractGroupValues(packet.getPayload()).entrySet()) {
            DetectorPriorityLevel status = evaluateConditions(entry.getValue());
            if (status.isActive()) {
                results.add(new DetectorEvaluationResult(entry.getKey(), true, status,
                        Map.of("value", entry.getValue())));
            }
        }
        return new DetectorEvaluation(results, updates);
    }

    @Override
    public void commitStateUpdates(DetectorEvaluation evaluation) {
        // stateless
    }
}
