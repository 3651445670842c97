package com.watchtower.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Payload of a metric data packet: one aggregated sample per group key.
 *
 * <p>
 * {@code sequence} is the dedupe value: it must increase with every update
 * published for a source. Observations are carried either per group key in
 * {@code groupValues} or, for ungrouped metrics, as a single {@code value}.
 * </p>
 *
 * <pre>
 * {"sequence": 42, "timestamp": "2024-01-01T00:00:00Z",
 *  "groupValues": {"eu-west": 12.5, "us-east": 3.0}}
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricUpdate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long sequence;
    private final Instant timestamp;
    private final Double value;
    private final Map<String, Double> groupValues;

    @JsonCreator
    public MetricUpdate(@JsonProperty(value = "sequence", required = true) long sequence,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("value") Double value,
            @JsonProperty("groupValues") Map<String, Double> groupValues) {
        this.sequence = sequence;
        this.timestamp = timestamp;
        this.value = value;
        this.groupValues = groupValues != null
                ? new LinkedHashMap<>(groupValues)
                : new LinkedHashMap<>();
    }

    /**
     * Convenience factory for an ungrouped sample.
     */
    public static MetricUpdate ungrouped(long sequence, double value) {
        return new MetricUpdate(sequence, Instant.now(), value, null);
    }

    /**
     * Convenience factory for a grouped sample; iteration order of
     * {@code groupValues} is preserved.
     */
    public static MetricUpdate grouped(long sequence, Map<String, Double> groupValues) {
        return new MetricUpdate(sequence, Instant.now(), null, groupValues);
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Double getValue() {
        return value;
    }

    /**
     * @return unmodifiable view of the grouped observations
     */
    public Map<String, Double> getGroupValues() {
        return Collections.unmodifiableMap(groupValues);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricUpdate that))
            return false;
        return sequence == that.sequence
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(value, that.value)
                && groupValues.equals(that.groupValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, timestamp, value, groupValues);
    }

    @Override
    public String toString() {
        return "MetricUpdate{" +
                "sequence=" + sequence +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", groupValues=" + groupValues +
                '}';
    }
}
