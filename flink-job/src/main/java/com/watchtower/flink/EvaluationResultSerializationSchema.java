package com.watchtower.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;

/**
 * Serializes {@link EvaluationResultMessage}s to JSON for the results topic.
 * <p>
 * Unlike the input side, a message that cannot be serialized fails the
 * operator: dropping it would lose a state transition that has already been
 * committed.
 * </p>
 */
public class EvaluationResultSerializationSchema implements SerializationSchema<EvaluationResultMessage> {

    private static final long serialVersionUID = 1L;

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(EvaluationResultMessage message) {
        try {
            return objectMapper().writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize evaluation result: " + message, e);
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
