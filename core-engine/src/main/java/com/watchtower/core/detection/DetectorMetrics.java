package com.watchtower.core.detection;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

/**
 * Counters incremented by the detector engine.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@value #SKIPPED_ALREADY_PROCESSED}: group key skipped because the
 * packet's dedupe value was already processed</li>
 * <li>{@value #SKIPPED_INVALID_CONDITION_GROUP}: group key skipped because
 * the detector has no condition group</li>
 * <li>{@value #DUPLICATE_GROUP_KEY}: duplicate group key in one detector's
 * results</li>
 * </ul>
 * <p>
 * Every counter is tagged with {@code detector_type}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorMetrics {

    public static final String SKIPPED_ALREADY_PROCESSED = "watchtower.detector.skipped_already_processed";
    public static final String SKIPPED_INVALID_CONDITION_GROUP = "watchtower.detector.skipped_invalid_condition_group";
    public static final String DUPLICATE_GROUP_KEY = "watchtower.detector.duplicate_group_key";

    static final String TAG_DETECTOR_TYPE = "detector_type";

    private final MeterRegistry registry;

    public DetectorMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
    }

    public void incrementSkippedAlreadyProcessed(String detectorType) {
        counter(SKIPPED_ALREADY_PROCESSED, detectorType).increment();
    }

    public void incrementSkippedInvalidConditionGroup(String detectorType) {
        counter(SKIPPED_INVALID_CONDITION_GROUP, detectorType).increment();
    }

    public void incrementDuplicateGroupKey(String detectorType) {
        counter(DUPLICATE_GROUP_KEY, detectorType).increment();
    }

    private Counter counter(String name, String detectorType) {
        return registry.counter(name, TAG_DETECTOR_TYPE, detectorType != null ? detectorType : "unknown");
    }
}
