package com.watchtower.core.detection;

import com.watchtower.core.condition.ConditionGroupSnapshot;
import com.watchtower.core.model.DataCondition;
import com.watchtower.core.model.DataConditionGroup;
import com.watchtower.core.model.Detector;
import com.watchtower.core.model.DetectorPriorityLevel;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for handlers: binds the detector and resolves its condition
 * group once, at construction, through the shared
 * {@link com.watchtower.core.condition.ConditionGroupCache}.
 *
 * @param <T> payload type
 */
public abstract class AbstractDetectorHandler<T> implements DetectorHandler<T> {

    protected final Detector detector;
    protected final DetectorHandlerContext context;

    private final ConditionGroupSnapshot conditionGroup;

    protected AbstractDetectorHandler(Detector detector, DetectorHandlerContext context) {
        this.detector = Objects.requireNonNull(detector, "Detector must not be null");
        this.context = Objects.requireNonNull(context, "DetectorHandlerContext must not be null");
        Long groupId = detector.getConditionGroupId();
        this.conditionGroup = groupId != null
                ? context.getConditionGroupCache().get(groupId)
                : ConditionGroupSnapshot.EMPTY;
    }

    @Override
    public Detector getDetector() {
        return detector;
    }

    /**
     * @return the detector's condition group; empty when none is configured
     *         or the configured one does not exist
     */
    public Optional<DataConditionGroup> getConditionGroup() {
        return conditionGroup.getGroup();
    }

    public List<DataCondition> getConditions() {
        return conditionGroup.getConditions();
    }

    /**
     * Run every condition against a value.
     *
     * @return the most severe priority among the conditions that fire;
     *         {@link DetectorPriorityLevel#OK} when none fire
     */
    protected DetectorPriorityLevel evaluateConditions(double value) {
        DetectorPriorityLevel status = DetectorPriorityLevel.OK;
        for (DataCondition condition : conditionGroup.getConditions()) {
            Optional<DetectorPriorityLevel> result = condition.evaluateValue(value);
            if (result.isPresent()) {
                status = DetectorPriorityLevel.max(status, result.get());
            }
        }
        return status;
    }
}
