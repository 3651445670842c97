package com.watchtower.flink;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.watchtower.core.model.Detector;
import com.watchtower.core.model.DetectorEvaluationResult;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message published to the results topic for every state transition.
 *
 * <pre>
 * {"detectorId": 100, "detectorName": "queue_depth", "groupKey": "eu-west",
 *  "active": true, "priority": "WARNING", "priorityLevel": 50,
 *  "sourceId": "queue-svc", "evaluatedAt": "2024-01-01T00:00:00Z", "data": {}}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class EvaluationResultMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    private long detectorId;
    private String detectorName;
    private String groupKey;
    private boolean active;
    private String priority;
    private int priorityLevel;
    private String sourceId;
    private Instant evaluatedAt;
    private Map<String, Object> data = new LinkedHashMap<>();

    public EvaluationResultMessage() {
    }

    public static EvaluationResultMessage of(Detector detector, DetectorEvaluationResult result,
            String sourceId, Instant evaluatedAt) {
        EvaluationResultMessage message = new EvaluationResultMessage();
        message.detectorId = detector.getId();
        message.detectorName = detector.getName();
        message.groupKey = result.getGroupKey();
        message.active = result.isActive();
        message.priority = result.getPriority().name();
        message.priorityLevel = result.getPriority().getLevel();
        message.sourceId = sourceId;
        message.evaluatedAt = evaluatedAt;
        message.data = new LinkedHashMap<>(result.getData());
        return message;
    }

    public long getDetectorId() {
        return detectorId;
    }

    public String getDetectorName() {
        return detectorName;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public boolean isActive() {
        return active;
    }

    public String getPriority() {
        return priority;
    }

    public int getPriorityLevel() {
        return priorityLevel;
    }

    public String getSourceId() {
        return sourceId;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    @Override
    public String toString() {
        return "EvaluationResultMessage{" +
                "detectorId=" + detectorId +
                ", groupKey='" + groupKey + '\'' +
                ", active=" + active +
                ", priority=" + priority +
                ", sourceId='" + sourceId + '\'' +
                '}';
    }
}
