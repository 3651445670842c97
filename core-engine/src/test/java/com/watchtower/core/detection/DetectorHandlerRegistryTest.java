package com.watchtower.core.detection;

import com.watchtower.core.condition.ConditionGroupCache;
import com.watchtower.core.condition.InMemoryConditionGroupRepository;
import com.watchtower.core.model.ConditionType;
import com.watchtower.core.model.DataCondition;
import com.watchtower.core.model.Detector;
import com.watchtower.core.model.DetectorPriorityLevel;
import com.watchtower.core.state.InMemoryDetectorStateRepository;
import com.watchtower.core.state.InMemoryEphemeralStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.watchtower.core.detection.MetricDetectorHandlerTest.group;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorHandlerRegistry}.
 */
class DetectorHandlerRegistryTest {

    private InMemoryConditionGroupRepository conditionRepository;
    private DetectorHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        conditionRepository = new InMemoryConditionGroupRepository();
        conditionRepository.saveGroup(group(1,
                new DataCondition(11, ConditionType.GT, 10, DetectorPriorityLevel.WARNING)));
        DetectorHandlerContext context = new DetectorHandlerContext(
                new ConditionGroupCache(conditionRepository),
                new InMemoryEphemeralStateStore(),
                new InMemoryDetectorStateRepository(),
                new DetectorMetrics(new SimpleMeterRegistry()));
        registry = DetectorHandlerRegistry.withDefaults(context);
    }

    @Test
    @DisplayName("Should register the built-in handler types")
    void shouldRegisterDefaults() {
        assertThat(registry.getRegisteredTypes())
                .containsExactlyInAnyOrder(MetricDetectorHandler.TYPE, ThresholdDetectorHandler.TYPE);
    }

    @Test
    @DisplayName("Should resolve a handler by detector type")
    void shouldResolveByType() {
        assertThat(registry.resolve(new Detector(1, "m", "metric", 1L)))
                .get().isInstanceOf(MetricDetectorHandler.class);
        assertThat(registry.resolve(new Detector(2, "t", "threshold", 1L)))
                .get().isInstanceOf(ThresholdDetectorHandler.class);
    }

    @Test
    @DisplayName("Should match detector types case-insensitively")
    void shouldIgnoreTypeCase() {
        Detector detector = new Detector(1, "m", "metric", 1L);
        detector.setType("METRIC");

        assertThat(registry.resolve(detector)).isPresent();
    }

    @Test
    @DisplayName("Should return empty for an unknown type")
    void shouldReturnEmptyForUnknownType() {
        assertThat(registry.resolve(new Detector(1, "x", "seasonal", 1L))).isEmpty();
        assertThat(registry.cachedHandlerCount()).isZero();
    }

    @Test
    @DisplayName("Should reuse the handler built for a detector id")
    void shouldCacheHandlers() {
        Detector detector = new Detector(1, "m", "metric", 1L);

        Optional<DetectorHandler<?>> first = registry.resolve(detector);
        Optional<DetectorHandler<?>> second = registry.resolve(detector);

        assertThat(first.get()).isSameAs(second.get());
        assertThat(registry.cachedHandlerCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should rebuild a handler after explicit invalidation")
    void shouldRebuildAfterInvalidate() {
        Detector detector = new Detector(1, "m", "metric", 1L);
        DetectorHandler<?> first = registry.resolve(detector).get();

        registry.invalidate(1);

        assertThat(registry.resolve(detector).get()).isNotSameAs(first);
    }

    @Test
    @DisplayName("Should evict handlers whose condition group changed")
    void shouldEvictOnConditionGroupChange() {
        Detector onGroup = new Detector(1, "m", "metric", 1L);
        Detector unconditioned = new Detector(2, "u", "metric", null);
        AbstractDetectorHandler<?> stale = (AbstractDetectorHandler<?>) registry.resolve(onGroup).get();
        registry.resolve(unconditioned);

        conditionRepository.saveCondition(conditionOfGroup(1, 12, ConditionType.GT, 50, DetectorPriorityLevel.HIGH));

        assertThat(registry.cachedHandlerCount()).isEqualTo(1);
        AbstractDetectorHandler<?> fresh = (AbstractDetectorHandler<?>) registry.resolve(onGroup).get();
        assertThat(fresh).isNotSameAs(stale);
        assertThat(stale.getConditions()).hasSize(1);
        assertThat(fresh.getConditions()).hasSize(2);
    }

    @Test
    @DisplayName("Should skip a detector whose type changed to one without a handler")
    void shouldSkipWhenTypeLosesItsHandler() {
        registry.resolve(new Detector(7, "m", "metric", 1L));

        assertThat(registry.resolve(new Detector(7, "m", "nonexistent", 1L))).isEmpty();
        assertThat(registry.cachedHandlerCount()).isZero();
    }

    @Test
    @DisplayName("Should rebuild a handler whose detector lost its condition group")
    void shouldRebuildWhenConditionGroupRemoved() {
        registry.resolve(new Detector(7, "m", "metric", 1L));

        MetricDetectorHandler handler =
                (MetricDetectorHandler) registry.resolve(new Detector(7, "m", "metric", null)).get();

        assertThat(handler.getConditionGroup()).isEmpty();
        assertThat(handler.evaluate(MetricDetectorHandlerTest.packet(1, "g1", 1_000)).getResults()).isEmpty();
    }

    @Test
    @DisplayName("Should rebuild a handler when the same detector instance is edited")
    void shouldRebuildWhenDetectorMutated() {
        Detector detector = new Detector(7, "m", "metric", 1L);
        DetectorHandler<?> first = registry.resolve(detector).get();

        detector.setCounterNames(List.of("breaches"));
        DetectorHandler<?> afterCounters = registry.resolve(detector).get();
        detector.setType("threshold");
        DetectorHandler<?> afterType = registry.resolve(detector).get();

        assertThat(afterCounters).isNotSameAs(first);
        assertThat(afterType).isInstanceOf(ThresholdDetectorHandler.class);
        assertThat(registry.resolve(detector).get()).isSameAs(afterType);
    }

    @Test
    @DisplayName("Should let a registration replace a built-in type")
    void shouldReplaceRegistration() {
        registry.register("Metric", (detector, context) -> new ThresholdDetectorHandler(detector, context));

        assertThat(registry.resolve(new Detector(1, "m", "metric", 1L)))
                .get().isInstanceOf(ThresholdDetectorHandler.class);
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNulls() {
        assertThatThrownBy(() -> registry.register(null, MetricDetectorHandler::new))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.resolve(null))
                .isInstanceOf(NullPointerException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DataCondition conditionOfGroup(long groupId, long id, ConditionType type,
            double comparison, DetectorPriorityLevel result) {
        DataCondition condition = new DataCondition(id, type, comparison, result);
        condition.setConditionGroupId(groupId);
        return condition;
    }
}
