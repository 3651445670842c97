package com.watchtower.flink;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.watchtower.core.model.DataPacket;
import com.watchtower.core.model.MetricUpdate;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeHint;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Converts raw Kafka bytes to {@code DataPacket<MetricUpdate>}.
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}) so one
 * bad record does not stop the pipeline.
 * </p>
 *
 * <pre>
 * {"sourceId": "queue-svc", "payload": {"sequence": 42, "groupValues": {"eu-west": 12.5}}}
 * </pre>
 */
public class DataPacketDeserializationSchema implements DeserializationSchema<DataPacket<MetricUpdate>> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DataPacketDeserializationSchema.class);

    private static final TypeReference<DataPacket<MetricUpdate>> PACKET_TYPE = new TypeReference<>() {
    };

    private transient ObjectMapper mapper;

    @Override
    public DataPacket<MetricUpdate> deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, PACKET_TYPE);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Skipping undecodable data packet: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(DataPacket<MetricUpdate> nextElement) {
        return false;
    }

    @Override
    public TypeInformation<DataPacket<MetricUpdate>> getProducedType() {
        return TypeInformation.of(new TypeHint<DataPacket<MetricUpdate>>() {
        });
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
        }
        return mapper;
    }
}
