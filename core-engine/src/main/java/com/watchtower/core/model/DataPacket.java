package com.watchtower.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed telemetry payload arriving for evaluation.
 *
 * <p>
 * The payload is opaque to the engine; each detector handler knows how to
 * derive a dedupe value and per-group-key observations from it.
 * {@link #getSourceId() sourceId} identifies the stream the packet came from.
 * Dedupe values are monotonic per source.
 * </p>
 *
 * @param <T> payload type
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DataPacket<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sourceId;
    private final T payload;

    /**
     * @param sourceId identifier of the originating stream; must not be {@code null}
     * @param payload  packet contents; must not be {@code null}
     */
    @JsonCreator
    public DataPacket(@JsonProperty("sourceId") String sourceId,
            @JsonProperty("payload") T payload) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
    }

    public String getSourceId() {
        return sourceId;
    }

    public T getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPacket<?> that))
            return false;
        return sourceId.equals(that.sourceId) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, payload);
    }

    @Override
    public String toString() {
        return "DataPacket{sourceId='" + sourceId + "', payload=" + payload + '}';
    }
}
