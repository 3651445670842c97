package com.watchtower.core.state;

import com.watchtower.core.model.DetectorPriorityLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Updates staged by one evaluation of one detector, waiting to be committed.
 *
 * <p>
 * Holds three maps keyed by group key ({@code null} = no group): dedupe
 * watermarks and counters for the ephemeral store, and
 * {@code (active, priority)} transitions for the durable store.
 * {@link DetectorStateStore#commit(StateUpdates)} drains each map once its
 * flush succeeds.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. An instance belongs to a single evaluate → commit cycle
 * on a single thread.
 * </p>
 *
 * @since 1.0.0
 */
public final class StateUpdates {

    private final long detectorId;
    private final Map<String, Long> dedupeUpdates = new LinkedHashMap<>();
    private final Map<String, Map<String, Integer>> counterUpdates = new LinkedHashMap<>();
    private final Map<String, Transition> stateUpdates = new LinkedHashMap<>();

    public StateUpdates(long detectorId) {
        this.detectorId = detectorId;
    }

    public long getDetectorId() {
        return detectorId;
    }

    public void enqueueDedupeUpdate(String groupKey, long dedupeValue) {
        dedupeUpdates.put(groupKey, dedupeValue);
    }

    /**
     * Stage counter values for a group key. A {@code null} value unsets the
     * counter; an empty map is still recorded.
     */
    public void enqueueCounterUpdate(String groupKey, Map<String, Integer> counters) {
        Objects.requireNonNull(counters, "counters must not be null");
        counterUpdates.put(groupKey, new LinkedHashMap<>(counters));
    }

    public void enqueueStateUpdate(String groupKey, boolean active, DetectorPriorityLevel priority) {
        stateUpdates.put(groupKey, new Transition(active, priority));
    }

    public Map<String, Long> getDedupeUpdates() {
        return Collections.unmodifiableMap(dedupeUpdates);
    }

    public Map<String, Map<String, Integer>> getCounterUpdates() {
        return Collections.unmodifiableMap(counterUpdates);
    }

    public Map<String, Transition> getStateUpdates() {
        return Collections.unmodifiableMap(stateUpdates);
    }

    public boolean hasEphemeralUpdates() {
        return !dedupeUpdates.isEmpty() || !counterUpdates.isEmpty();
    }

    public boolean isEmpty() {
        return !hasEphemeralUpdates() && stateUpdates.isEmpty();
    }

    void clearEphemeralUpdates() {
        dedupeUpdates.clear();
        counterUpdates.clear();
    }

    void clearStateUpdates() {
        stateUpdates.clear();
    }

    @Override
    public String toString() {
        return "StateUpdates{" +
                "detectorId=" + detectorId +
                ", dedupeUpdates=" + dedupeUpdates +
                ", counterUpdates=" + counterUpdates +
                ", stateUpdates=" + stateUpdates +
                '}';
    }

    /**
     * Staged durable transition for one group key.
     */
    public static final class Transition {

        private final boolean active;
        private final DetectorPriorityLevel priority;

        public Transition(boolean active, DetectorPriorityLevel priority) {
            this.active = active;
            this.priority = Objects.requireNonNull(priority, "priority must not be null");
        }

        public boolean isActive() {
            return active;
        }

        public DetectorPriorityLevel getPriority() {
            return priority;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Transition that))
                return false;
            return active == that.active && priority == that.priority;
        }

        @Override
        public int hashCode() {
            return Objects.hash(active, priority);
        }

        @Override
        public String toString() {
            return "(" + active + ", " + priority + ')';
        }
    }
}
