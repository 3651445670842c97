package com.watchtower.core.detection;

import com.watchtower.core.model.DetectorPriorityLevel;
import com.watchtower.core.model.DetectorStateData;

import java.util.Map;

/**
 * Computes the named counter values to stage for one group key.
 * <p>
 * The returned map is staged as-is: a {@code null} value unsets the counter,
 * counters not present in the map are left untouched.
 * </p>
 */
@FunctionalInterface
public interface CounterUpdateStrategy {

    /** Stages an empty update for every group key. */
    CounterUpdateStrategy NONE = (groupKey, value, stateData, status) -> Map.of();

    Map<String, Integer> computeCounterUpdates(String groupKey, double value,
            DetectorStateData stateData, DetectorPriorityLevel status);
}
