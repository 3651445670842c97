package com.watchtower.flink;

import com.watchtower.core.config.DetectorsConfig;
import com.watchtower.core.config.DetectorsLoader;
import com.watchtower.core.model.DataPacket;
import com.watchtower.core.model.MetricUpdate;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point of the Watchtower Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (data packets topic)
 *     → Deserialize JSON → DataPacket&lt;MetricUpdate&gt;
 *     → Key by source id
 *     → DetectorProcessFunction (evaluate all detectors, commit state)
 *     → Serialize EvaluationResultMessage → JSON
 *     → Kafka (results topic)
 * </pre>
 *
 * <p>
 * All settings come from environment variables via {@link JobConfig}; the
 * detector catalogue from {@link DetectorsLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class WatchtowerJob {

        private static final Logger LOG = LoggerFactory.getLogger(WatchtowerJob.class);

        private WatchtowerJob() {
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Watchtower with config: {}", config);

                DetectorsConfig detectorsConfig = loadDetectors(config);
                if (detectorsConfig.getDetectors().isEmpty()) {
                        throw new IllegalStateException(
                                        "No detectors defined. Provide them via "
                                                        + DetectorsLoader.ENV_DETECTORS_PATH
                                                        + " or a classpath " + DetectorsLoader.DEFAULT_RESOURCE + " file.");
                }

                HealthServer healthServer = new HealthServer();
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                buildPipeline(env, config, detectorsConfig);
                healthServer.markReady();

                env.execute("Watchtower: Stateful Detectors");
        }

        /**
         * Build the Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        DetectorsConfig detectorsConfig) {
                KafkaSource<DataPacket<MetricUpdate>> kafkaSource = KafkaSource.<DataPacket<MetricUpdate>>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new DataPacketDeserializationSchema())
                                .build();

                DataStream<DataPacket<MetricUpdate>> packets = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-data-packets-source");

                DataStream<EvaluationResultMessage> results = packets
                                .filter(Objects::nonNull)
                                .keyBy(DataPacket::getSourceId, Types.STRING)
                                .process(new DetectorProcessFunction(config, detectorsConfig))
                                .name("stateful-detectors");

                KafkaSink<EvaluationResultMessage> kafkaSink = KafkaSink.<EvaluationResultMessage>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaResultTopic())
                                                                .setValueSerializationSchema(
                                                                                new EvaluationResultSerializationSchema())
                                                                .build())
                                .build();

                results.sinkTo(kafkaSink).name("kafka-results-sink");
        }

        private static DetectorsConfig loadDetectors(JobConfig config) {
                String path = config.getDetectorsConfigPath();
                if (path != null && !path.isBlank()) {
                        return DetectorsLoader.fromFile(path);
                }
                return DetectorsLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.AT_LEAST_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
        }
}
