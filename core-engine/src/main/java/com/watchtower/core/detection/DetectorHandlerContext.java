package com.watchtower.core.detection;

import com.watchtower.core.condition.ConditionGroupCache;
import com.watchtower.core.state.DetectorStateRepository;
import com.watchtower.core.state.DetectorStateStore;
import com.watchtower.core.state.EphemeralStateStore;

import java.util.Objects;

/**
 * Shared collaborators handed to every handler built by a
 * {@link DetectorHandlerRegistry}.
 */
public class DetectorHandlerContext {

    private final ConditionGroupCache conditionGroupCache;
    private final EphemeralStateStore ephemeralStateStore;
    private final DetectorStateRepository stateRepository;
    private final DetectorMetrics metrics;
    private final CounterUpdateStrategy counterUpdateStrategy;

    public DetectorHandlerContext(ConditionGroupCache conditionGroupCache,
            EphemeralStateStore ephemeralStateStore,
            DetectorStateRepository stateRepository,
            DetectorMetrics metrics) {
        this(conditionGroupCache, ephemeralStateStore, stateRepository, metrics, CounterUpdateStrategy.NONE);
    }

    public DetectorHandlerContext(ConditionGroupCache conditionGroupCache,
            EphemeralStateStore ephemeralStateStore,
            DetectorStateRepository stateRepository,
            DetectorMetrics metrics,
            CounterUpdateStrategy counterUpdateStrategy) {
        this.conditionGroupCache = Objects.requireNonNull(conditionGroupCache, "ConditionGroupCache must not be null");
        this.ephemeralStateStore = Objects.requireNonNull(ephemeralStateStore, "EphemeralStateStore must not be null");
        this.stateRepository = Objects.requireNonNull(stateRepository, "DetectorStateRepository must not be null");
        this.metrics = Objects.requireNonNull(metrics, "DetectorMetrics must not be null");
        this.counterUpdateStrategy = Objects.requireNonNull(counterUpdateStrategy,
                "CounterUpdateStrategy must not be null");
    }

    /**
     * Build the state store of one detector over the shared backends.
     */
    public DetectorStateStore stateStoreFor(long detectorId) {
        return new DetectorStateStore(detectorId, ephemeralStateStore, stateRepository);
    }

    public ConditionGroupCache getConditionGroupCache() {
        return conditionGroupCache;
    }

    public EphemeralStateStore getEphemeralStateStore() {
        return ephemeralStateStore;
    }

    public DetectorStateRepository getStateRepository() {
        return stateRepository;
    }

    public DetectorMetrics getMetrics() {
        return metrics;
    }

    public CounterUpdateStrategy getCounterUpdateStrategy() {
        return counterUpdateStrategy;
    }
}
