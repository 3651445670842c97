package com.watchtower.flink;

import com.watchtower.core.condition.ConditionGroupCache;
import com.watchtower.core.config.DetectorsConfig;
import com.watchtower.core.detection.DetectorHandlerContext;
import com.watchtower.core.detection.DetectorHandlerRegistry;
import com.watchtower.core.detection.DetectorMetrics;
import com.watchtower.core.detection.DetectorProcessor;
import com.watchtower.core.detection.DetectorResults;
import com.watchtower.core.detection.ProcessingResult;
import com.watchtower.core.model.DataPacket;
import com.watchtower.core.model.Detector;
import com.watchtower.core.model.DetectorEvaluationResult;
import com.watchtower.core.model.MetricUpdate;
import com.watchtower.core.state.JdbcDetectorStateRepository;
import com.watchtower.core.state.RedissonEphemeralStateStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.Metrics;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Keyed process function that runs every configured detector against each
 * data packet and emits one {@link EvaluationResultMessage} per state
 * transition.
 *
 * <p>
 * The stream is keyed by source id, so packets of one source are evaluated
 * sequentially by one subtask. Ephemeral state is keyed by detector id and
 * group key only, not by source: every group key must belong to a single
 * source, otherwise two sources sharing a group key share one dedupe
 * watermark and race across subtasks.
 * </p>
 *
 * <h3>State Management</h3>
 * <p>
 * Detector state does not live in Flink state: it is read from Redis and
 * MySQL on every packet and committed right after the results are emitted.
 * A failing store fails the packet; Flink's restart strategy replays it from
 * the last checkpoint and the dedupe watermark discards what was already
 * committed.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorProcessFunction
        extends KeyedProcessFunction<String, DataPacket<MetricUpdate>, EvaluationResultMessage> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DetectorProcessFunction.class);

    private final JobConfig config;
    private final DetectorsConfig detectorsConfig;

    private transient RedissonClient redissonClient;
    private transient HikariDataSource dataSource;
    private transient DetectorProcessor processor;
    private transient List<Detector> detectors;
    private transient EngineMetrics metrics;

    /**
     * @param config          job configuration
     * @param detectorsConfig validated detector catalogue; must define at least one detector
     * @throws IllegalArgumentException if no detector is configured
     */
    public DetectorProcessFunction(JobConfig config, DetectorsConfig detectorsConfig) {
        this.config = Objects.requireNonNull(config, "JobConfig must not be null");
        this.detectorsConfig = Objects.requireNonNull(detectorsConfig, "DetectorsConfig must not be null");
        if (detectorsConfig.getDetectors().isEmpty()) {
            throw new IllegalArgumentException("Detectors list must not be empty");
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        org.redisson.config.Config redissonConfig = new org.redisson.config.Config();
        redissonConfig.useSingleServer().setAddress(config.getRedisAddress());
        redissonClient = Redisson.create(redissonConfig);

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.getJdbcUrl());
        hikariConfig.setUsername(config.getJdbcUser());
        hikariConfig.setPassword(config.getJdbcPassword());
        hikariConfig.setMaximumPoolSize(config.getJdbcPoolSize());
        hikariConfig.setPoolName("watchtower-detector-state");
        dataSource = new HikariDataSource(hikariConfig);

        ConditionGroupCache conditionGroupCache = new ConditionGroupCache(
                detectorsConfig.toConditionGroupRepository(),
                config.getConditionCacheMaxSize(),
                config.getConditionCacheTtl());
        DetectorMetrics detectorMetrics = new DetectorMetrics(Metrics.globalRegistry);
        DetectorHandlerContext context = new DetectorHandlerContext(
                conditionGroupCache,
                new RedissonEphemeralStateStore(redissonClient),
                new JdbcDetectorStateRepository(new JdbcTemplate(dataSource)),
                detectorMetrics);

        processor = new DetectorProcessor(DetectorHandlerRegistry.withDefaults(context), detectorMetrics);
        detectors = detectorsConfig.getDetectors();
        metrics = new EngineMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("DetectorProcessFunction opened with {} detector(s)", detectors.size());
    }

    @Override
    public void close() {
        LOG.info("DetectorProcessFunction closing");
        if (redissonClient != null) {
            redissonClient.shutdown();
        }
        if (dataSource != null) {
            dataSource.close();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(DataPacket<MetricUpdate> packet,
            KeyedProcessFunction<String, DataPacket<MetricUpdate>, EvaluationResultMessage>.Context ctx,
            Collector<EvaluationResultMessage> out) {
        long startNanos = System.nanoTime();

        ProcessingResult result = processor.process(packet, detectors);
        Instant evaluatedAt = Instant.now();
        for (DetectorResults detectorResults : result.getDetectorResults()) {
            for (DetectorEvaluationResult evaluation : detectorResults.getResults()) {
                out.collect(EvaluationResultMessage.of(
                        detectorResults.getDetector(), evaluation, packet.getSourceId(), evaluatedAt));
                LOG.info("Detector {} group key '{}' is now active={} priority={}",
                        detectorResults.getDetector().getId(), evaluation.getGroupKey(),
                        evaluation.isActive(), evaluation.getPriority());
            }
        }
        result.commitStateUpdates();

        metrics.incrementPacketsProcessed();
        metrics.incrementEvaluationResults(result.resultCount());
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
