package com.watchtower.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory snapshot of a group key's state, merged from both stores.
 *
 * <p>
 * {@code active} and {@code status} come from the durable store;
 * {@code dedupeValue} and {@code counterValues} come from the ephemeral
 * store. A counter mapped to {@code null} has never been set, which is
 * distinct from a counter set to zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorStateData {

    private final String groupKey;
    private final boolean active;
    private final DetectorPriorityLevel status;
    private final long dedupeValue;
    private final Map<String, Integer> counterValues;

    public DetectorStateData(String groupKey, boolean active, DetectorPriorityLevel status,
            long dedupeValue, Map<String, Integer> counterValues) {
        this.groupKey = groupKey;
        this.active = active;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.dedupeValue = dedupeValue;
        // LinkedHashMap: counter values may legitimately be null
        this.counterValues = counterValues != null
                ? new LinkedHashMap<>(counterValues)
                : new LinkedHashMap<>();
    }

    /**
     * State of a group key that has never been seen: inactive, {@code OK},
     * watermark {@code 0}, no counters.
     */
    public static DetectorStateData defaults(String groupKey) {
        return new DetectorStateData(groupKey, false, DetectorPriorityLevel.OK, 0L, null);
    }

    public String getGroupKey() {
        return groupKey;
    }

    public boolean isActive() {
        return active;
    }

    public DetectorPriorityLevel getStatus() {
        return status;
    }

    public long getDedupeValue() {
        return dedupeValue;
    }

    /**
     * @return unmodifiable view of counter values; {@code null} values mean "unset"
     */
    public Map<String, Integer> getCounterValues() {
        return Collections.unmodifiableMap(counterValues);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorStateData that))
            return false;
        return active == that.active
                && dedupeValue == that.dedupeValue
                && Objects.equals(groupKey, that.groupKey)
                && status == that.status
                && counterValues.equals(that.counterValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupKey, active, status, dedupeValue, counterValues);
    }

    @Override
    public String toString() {
        return "DetectorStateData{" +
                "groupKey='" + groupKey + '\'' +
                ", active=" + active +
                ", status=" + status +
                ", dedupeValue=" + dedupeValue +
                ", counterValues=" + counterValues +
                '}';
    }
}
