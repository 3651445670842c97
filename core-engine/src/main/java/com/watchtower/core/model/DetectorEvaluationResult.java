package com.watchtower.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of evaluating one group key, emitted only when its state changed.
 *
 * @since 1.0.0
 */
public final class DetectorEvaluationResult {

    private final String groupKey;
    private final boolean active;
    private final DetectorPriorityLevel priority;
    private final Map<String, Object> data;

    public DetectorEvaluationResult(String groupKey, boolean active,
            DetectorPriorityLevel priority, Map<String, Object> data) {
        this.groupKey = groupKey;
        this.active = active;
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
    }

    public DetectorEvaluationResult(String groupKey, boolean active, DetectorPriorityLevel priority) {
        this(groupKey, active, priority, null);
    }

    /**
     * @return the group key, {@code null} for the "no group" key
     */
    public String getGroupKey() {
        return groupKey;
    }

    public boolean isActive() {
        return active;
    }

    public DetectorPriorityLevel getPriority() {
        return priority;
    }

    /**
     * @return unmodifiable handler-specific extra data
     */
    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorEvaluationResult that))
            return false;
        return active == that.active
                && Objects.equals(groupKey, that.groupKey)
                && priority == that.priority
                && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupKey, active, priority, data);
    }

    @Override
    public String toString() {
        return "DetectorEvaluationResult{" +
                "groupKey='" + groupKey + '\'' +
                ", active=" + active +
                ", priority=" + priority +
                ", data=" + data +
                '}';
    }
}
