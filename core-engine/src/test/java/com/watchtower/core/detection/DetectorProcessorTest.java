package com.watchtower.core.detection;

import com.watchtower.core.condition.ConditionGroupCache;
import com.watchtower.core.condition.InMemoryConditionGroupRepository;
import com.watchtower.core.model.ConditionType;
import com.watchtower.core.model.DataCondition;
import com.watchtower.core.model.DataPacket;
import com.watchtower.core.model.Detector;
import com.watchtower.core.model.DetectorEvaluationResult;
import com.watchtower.core.model.DetectorPriorityLevel;
import com.watchtower.core.model.MetricUpdate;
import com.watchtower.core.state.InMemoryDetectorStateRepository;
import com.watchtower.core.state.InMemoryEphemeralStateStore;
import com.watchtower.core.state.StateUpdates;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.watchtower.core.detection.MetricDetectorHandlerTest.group;
import static com.watchtower.core.detection.MetricDetectorHandlerTest.packet;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectorProcessor}.
 */
class DetectorProcessorTest {

    private InMemoryEphemeralStateStore ephemeral;
    private InMemoryDetectorStateRepository stateRepository;
    private SimpleMeterRegistry meterRegistry;
    private DetectorHandlerRegistry registry;
    private DetectorProcessor processor;

    @BeforeEach
    void setUp() {
        InMemoryConditionGroupRepository conditionRepository = new InMemoryConditionGroupRepository();
        conditionRepository.saveGroup(group(1,
                new DataCondition(11, ConditionType.GT, 10, DetectorPriorityLevel.WARNING)));
        ephemeral = new InMemoryEphemeralStateStore();
        stateRepository = new InMemoryDetectorStateRepository();
        meterRegistry = new SimpleMeterRegistry();
        DetectorMetrics metrics = new DetectorMetrics(meterRegistry);
        DetectorHandlerContext context = new DetectorHandlerContext(
                new ConditionGroupCache(conditionRepository), ephemeral, stateRepository, metrics);
        registry = DetectorHandlerRegistry.withDefaults(context);
        processor = new DetectorProcessor(registry, metrics);
    }

    @Test
    @DisplayName("Should group results by detector in input order")
    void shouldGroupResultsByDetector() {
        Detector first = new Detector(1, "first", "metric", 1L);
        Detector second = new Detector(2, "second", "threshold", 1L);

        ProcessingResult result = processor.process(packet(1, "g1", 15), List.of(first, second));

        assertThat(result.getDetectorResults()).extracting(DetectorResults::getDetector)
                .containsExactly(first, second);
        assertThat(result.resultCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should skip detectors of unknown type without failing the packet")
    void shouldSkipUnknownTypes() {
        Detector unknown = new Detector(1, "unknown", "seasonal", 1L);
        Detector known = new Detector(2, "known", "metric", 1L);

        ProcessingResult result = processor.process(packet(1, "g1", 15), List.of(unknown, known));

        assertThat(result.getDetectorResults()).extracting(DetectorResults::getDetector)
                .containsExactly(known);
    }

    @Test
    @DisplayName("Should omit detectors that produced no results")
    void shouldOmitEmptyResults() {
        ProcessingResult result = processor.process(packet(1, "g1", 5),
                List.of(new Detector(1, "quiet", "metric", 1L)));

        assertThat(result.getDetectorResults()).isEmpty();
        assertThat(result.resultCount()).isZero();
    }

    @Test
    @DisplayName("Should not persist anything until commit")
    void shouldDeferWritesUntilCommit() {
        Detector detector = new Detector(1, "m", "metric", 1L);

        ProcessingResult result = processor.process(packet(1, "g1", 15), List.of(detector));

        assertThat(ephemeral.size()).isZero();
        assertThat(stateRepository.rows()).isEmpty();

        result.commitStateUpdates();

        assertThat(ephemeral.get("1:g1:dedupe_value")).isEqualTo("1");
        assertThat(stateRepository.row(1, "g1").isActive()).isTrue();
    }

    @Test
    @DisplayName("Should commit even detectors that produced no results")
    void shouldCommitQuietDetectors() {
        Detector detector = new Detector(1, "quiet", "metric", 1L);

        processor.process(packet(4, "g1", 5), List.of(detector)).commitStateUpdates();

        assertThat(ephemeral.get("1:g1:dedupe_value")).isEqualTo("4");
    }

    @Test
    @DisplayName("Should produce nothing when a committed packet is redelivered")
    void shouldIgnoreRedelivery() {
        List<Detector> detectors = List.of(new Detector(1, "m", "metric", 1L));
        processor.process(packet(1, "g1", 15), detectors).commitStateUpdates();

        ProcessingResult replay = processor.process(packet(1, "g1", 15), detectors);

        assertThat(replay.getDetectorResults()).isEmpty();
    }

    @Test
    @DisplayName("Should share one watermark per group key across sources")
    void shouldShareWatermarkAcrossSources() {
        List<Detector> detectors = List.of(new Detector(1, "m", "metric", 1L));
        processor.process(new DataPacket<>("source-a", MetricUpdate.grouped(5, Map.of("g1", 15.0))), detectors)
                .commitStateUpdates();

        ProcessingResult fromOtherSource = processor.process(
                new DataPacket<>("source-b", MetricUpdate.grouped(3, Map.of("g1", 1.0))), detectors);

        assertThat(fromOtherSource.getDetectorResults()).isEmpty();
        assertThat(ephemeral.get("1:g1:dedupe_value")).isEqualTo("5");
    }

    @Test
    @DisplayName("Should commit handlers in detector order")
    void shouldCommitInOrder() {
        List<Long> committed = new ArrayList<>();
        registry.register("recording", (detector, context) -> new RecordingHandler(detector, committed));

        processor.process(packet(1, "g1", 15), List.of(
                new Detector(3, "c", "recording", null),
                new Detector(1, "a", "recording", null),
                new Detector(2, "b", "recording", null))).commitStateUpdates();

        assertThat(committed).containsExactly(3L, 1L, 2L);
    }

    @Test
    @DisplayName("Should log and count duplicate group keys but keep every result")
    void shouldReportDuplicateGroupKeys() {
        registry.register("duplicating", (detector, context) -> new DuplicatingHandler(detector));
        Detector detector = new Detector(9, "dup", "duplicating", null);

        ProcessingResult result = processor.process(packet(1, "g1", 15), List.of(detector));

        assertThat(result.getDetectorResults()).singleElement()
                .extracting(DetectorResults::getResults)
                .asList().hasSize(3);
        assertThat(meterRegistry.counter(DetectorMetrics.DUPLICATE_GROUP_KEY,
                DetectorMetrics.TAG_DETECTOR_TYPE, "duplicating").count()).isEqualTo(2.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static final class RecordingHandler implements DetectorHandler<MetricUpdate> {

        private final Detector detector;
        private final List<Long> committed;

        RecordingHandler(Detector detector, List<Long> committed) {
            this.detector = detector;
            this.committed = committed;
        }

        @Override
        public DetectorEvaluation evaluate(DataPacket<MetricUpdate> packet) {
            return new DetectorEvaluation(List.of(), new StateUpdates(detector.getId()));
        }

        @Override
        public void commitStateUpdates(DetectorEvaluation evaluation) {
            committed.add(detector.getId());
        }

        @Override
        public Detector getDetector() {
            return detector;
        }
    }

    private static final class DuplicatingHandler implements DetectorHandler<MetricUpdate> {

        private final Detector detector;

        DuplicatingHandler(Detector detector) {
            this.detector = detector;
        }

        @Override
        public DetectorEvaluation evaluate(DataPacket<MetricUpdate> packet) {
            List<DetectorEvaluationResult> results = List.of(
                    new DetectorEvaluationResult("g1", true, DetectorPriorityLevel.HIGH),
                    new DetectorEvaluationResult("g1", true, DetectorPriorityLevel.LOW),
                    new DetectorEvaluationResult("g1", false, DetectorPriorityLevel.OK, Map.of()));
            return new DetectorEvaluation(results, new StateUpdates(detector.getId()));
        }

        @Override
        public void commitStateUpdates(DetectorEvaluation evaluation) {
        }

        @Override
        public Detector getDetector() {
            return detector;
        }
    }
}
