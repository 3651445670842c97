package com.watchtower.core.detection;

import com.watchtower.core.model.DataPacket;
import com.watchtower.core.model.Detector;
import com.watchtower.core.model.DetectorEvaluationResult;
import com.watchtower.core.model.DetectorPriorityLevel;
import com.watchtower.core.model.DetectorStateData;
import com.watchtower.core.state.DetectorStateStore;
import com.watchtower.core.state.StateUpdates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Handler that tracks, per group key, whether the detector is active and at
 * which priority, and only reports transitions.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Extract the packet's dedupe value and its {@code groupKey -> value}
 * observations.</li>
 * <li>Fetch the stored state of every group key in one batch.</li>
 * <li>For each group key:
 * <ul>
 * <li>dedupe value not above the stored watermark: skip, stage nothing</li>
 * <li>otherwise stage the new watermark</li>
 * <li>no condition group: skip</li>
 * <li>status = most severe firing condition (OK when none fire), active =
 * status above OK</li>
 * <li>stage the counter update, possibly empty</li>
 * <li>active or status changed: stage the transition and emit a result</li>
 * </ul>
 * </li>
 * </ol>
 * <p>
 * Nothing is written until {@link #commitStateUpdates(DetectorEvaluation)};
 * evaluating the same packet twice without committing yields the same
 * results both times.
 * </p>
 *
 * @param <T> payload type
 */
public abstract class StatefulDetectorHandler<T> extends AbstractDetectorHandler<T> {

    private static final Logger LOG = LoggerFactory.getLogger(StatefulDetectorHandler.class);

    private final DetectorStateStore stateStore;

    protected StatefulDetectorHandler(Detector detector, DetectorHandlerContext context) {
        super(detector, context);
        this.stateStore = context.stateStoreFor(detector.getId());
    }

    /**
     * @return the watermark identifying this packet in its source's stream
     */
    protected abstract long getDedupeValue(DataPacket<T> packet);

    /**
     * @return observation per group key, {@code null} key meaning "no group";
     *         values must not be {@code null}
     */
    protected abstract Map<String, Double> getGroupKeyValues(DataPacket<T> packet);

    /**
     * @return names of the counters kept per group key
     */
    protected abstract List<String> getCounterNames();

    /**
     * Counter values to stage for a group key. Delegates to the context's
     * {@link CounterUpdateStrategy}.
     */
    protected Map<String, Integer> computeCounterUpdates(String groupKey, double value,
            DetectorStateData stateData, DetectorPriorityLevel status) {
        return context.getCounterUpdateStrategy().computeCounterUpdates(groupKey, value, stateData, status);
    }

    @Override
    public DetectorEvaluation evaluate(DataPacket<T> packet) {
        Objects.requireNonNull(packet, "DataPacket must not be null");

        long dedupeValue = getDedupeValue(packet);
        Map<String, Double> groupValues = getGroupKeyValues(packet);
        StateUpdates updates = new StateUpdates(detector.getId());
        List<DetectorEvaluationResult> results = new ArrayList<>();
        if (groupValues.isEmpty()) {
            return new DetectorEvaluation(results, updates);
        }

        Map<String, DetectorStateData> states = stateStore.getStateData(
                new ArrayList<>(groupValues.keySet()), getCounterNames());

        for (Map.Entry<String, Double> entry : groupValues.entrySet()) {
            String groupKey = entry.getKey();
            double value = Objects.requireNonNull(entry.getValue(),
                    () -> "Observation for group key '" + groupKey + "' must not be null");
            DetectorStateData stateData = states.get(groupKey);

            if (dedupeValue <= stateData.getDedupeValue()) {
                LOG.debug("Detector {} skipping already processed update for group key '{}': {} <= {}",
                        detector.getId(), groupKey, dedupeValue, stateData.getDedupeValue());
                context.getMetrics().incrementSkippedAlreadyProcessed(detector.getType());
                continue;
            }
            updates.enqueueDedupeUpdate(groupKey, dedupeValue);

            if (getConditionGroup().isEmpty()) {
                context.getMetrics().incrementSkippedInvalidConditionGroup(detector.getType());
                continue;
            }

            DetectorPriorityLevel status = evaluateConditions(value);
            boolean active = status.isActive();

            updates.enqueueCounterUpdate(groupKey, computeCounterUpdates(groupKey, value, stateData, status));

            if (active != stateData.isActive() || status != stateData.getStatus()) {
                updates.enqueueStateUpdate(groupKey, active, status);
                results.add(new DetectorEvaluationResult(groupKey, active, status));
                LOG.debug("Detector {} group key '{}' transitioned ({}, {}) -> ({}, {})",
                        detector.getId(), groupKey, stateData.isActive(), stateData.getStatus(), active, status);
            }
        }
        return new DetectorEvaluation(results, updates);
    }

    @Override
    public void commitStateUpdates(DetectorEvaluation evaluation) {
        Objects.requireNonNull(evaluation, "DetectorEvaluation must not be null");
        stateStore.commit(evaluation.getStateUpdates());
    }

    protected DetectorStateStore getStateStore() {
        return stateStore;
    }
}
