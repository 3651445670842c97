package com.watchtower.core.state;

import com.watchtower.core.model.DetectorPriorityLevel;
import com.watchtower.core.model.DetectorState;
import com.watchtower.core.model.DetectorStateData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-detector view over the ephemeral and durable stores.
 *
 * <h3>Key layout</h3>
 * <ul>
 * <li>{@code {detectorId}:{groupKey}:dedupe_value}: last processed dedupe
 * value</li>
 * <li>{@code {detectorId}:{groupKey}:{counterName}}: named counter</li>
 * </ul>
 * <p>
 * The "no group" key renders as an empty segment. Every ephemeral value
 * expires after {@link #STATE_TTL}.
 * </p>
 *
 * <h3>Round trips</h3>
 * <p>
 * {@link #getStateData} issues one durable query plus at most two ephemeral
 * pipelines regardless of the number of group keys. {@link #commit} issues
 * one ephemeral pipeline, one durable re-read, and at most one bulk insert
 * and one bulk update.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorStateStore.class);

    /** Expiry applied to every dedupe watermark and counter. */
    public static final Duration STATE_TTL = Duration.ofDays(7);

    static final String DEDUPE_VALUE_SUFFIX = "dedupe_value";

    private final long detectorId;
    private final EphemeralStateStore ephemeralStore;
    private final DetectorStateRepository repository;

    public DetectorStateStore(long detectorId, EphemeralStateStore ephemeralStore,
            DetectorStateRepository repository) {
        this.detectorId = detectorId;
        this.ephemeralStore = Objects.requireNonNull(ephemeralStore, "EphemeralStateStore must not be null");
        this.repository = Objects.requireNonNull(repository, "DetectorStateRepository must not be null");
    }

    // ---------------------------------------------------------------
    // Fetch
    // ---------------------------------------------------------------

    /**
     * Fetch the merged state of every requested group key. Keys with no
     * stored state get {@link DetectorStateData#defaults(String)} values.
     *
     * @param groupKeys    group keys to fetch; may contain {@code null}
     * @param counterNames counters declared by the detector; may be empty
     * @return snapshot per group key, in the order of {@code groupKeys}
     * @throws StateStoreException if either store is unavailable
     */
    public Map<String, DetectorStateData> getStateData(List<String> groupKeys, List<String> counterNames) {
        Objects.requireNonNull(groupKeys, "groupKeys must not be null");
        Objects.requireNonNull(counterNames, "counterNames must not be null");

        Map<String, DetectorState> durableStates = repository.findByGroupKeys(detectorId, groupKeys);

        List<String> dedupeKeys = new ArrayList<>(groupKeys.size());
        for (String groupKey : groupKeys) {
            dedupeKeys.add(buildDedupeValueKey(groupKey));
        }
        List<String> dedupeValues = ephemeralStore.getAll(dedupeKeys);

        List<String> counterValues = List.of();
        if (!counterNames.isEmpty()) {
            List<String> counterKeys = new ArrayList<>(groupKeys.size() * counterNames.size());
            for (String groupKey : groupKeys) {
                for (String counterName : counterNames) {
                    counterKeys.add(buildCounterValueKey(groupKey, counterName));
                }
            }
            counterValues = ephemeralStore.getAll(counterKeys);
        }

        Map<String, DetectorStateData> results = new LinkedHashMap<>();
        for (int i = 0; i < groupKeys.size(); i++) {
            String groupKey = groupKeys.get(i);

            Map<String, Integer> counters = new LinkedHashMap<>();
            for (int c = 0; c < counterNames.size(); c++) {
                String raw = counterValues.get(i * counterNames.size() + c);
                counters.put(counterNames.get(c), isAbsent(raw) ? null : parseInt(raw, groupKey));
            }

            String rawDedupe = dedupeValues.get(i);
            long dedupeValue = isAbsent(rawDedupe) ? 0L : parseLong(rawDedupe, groupKey);

            DetectorState durable = durableStates.get(groupKey);
            results.put(groupKey, new DetectorStateData(
                    groupKey,
                    durable != null && durable.isActive(),
                    durable != null ? durable.getState() : DetectorPriorityLevel.OK,
                    dedupeValue,
                    counters));
        }
        return results;
    }

    // ---------------------------------------------------------------
    // Commit
    // ---------------------------------------------------------------

    /**
     * Flush staged updates to both stores: the ephemeral store first, then the
     * durable store. Each part of {@code updates} is drained only after its
     * flush succeeds, so retrying after a failure repeats only the unfinished
     * part.
     *
     * @param updates staged updates of this detector
     * @throws StateStoreException if either store is unavailable
     */
    public void commit(StateUpdates updates) {
        Objects.requireNonNull(updates, "updates must not be null");
        if (updates.getDetectorId() != detectorId) {
            throw new IllegalArgumentException("Updates of detector " + updates.getDetectorId()
                    + " cannot be committed to the store of detector " + detectorId);
        }
        commitEphemeralState(updates);
        commitDurableState(updates);
    }

    void commitEphemeralState(StateUpdates updates) {
        if (!updates.hasEphemeralUpdates()) {
            return;
        }
        List<CacheWrite> writes = new ArrayList<>();
        for (Map.Entry<String, Long> entry : updates.getDedupeUpdates().entrySet()) {
            writes.add(CacheWrite.set(buildDedupeValueKey(entry.getKey()),
                    Long.toString(entry.getValue()), STATE_TTL));
        }
        for (Map.Entry<String, Map<String, Integer>> entry : updates.getCounterUpdates().entrySet()) {
            for (Map.Entry<String, Integer> counter : entry.getValue().entrySet()) {
                String key = buildCounterValueKey(entry.getKey(), counter.getKey());
                writes.add(counter.getValue() == null
                        ? CacheWrite.delete(key)
                        : CacheWrite.set(key, Integer.toString(counter.getValue()), STATE_TTL));
            }
        }
        ephemeralStore.writeAll(writes);
        updates.clearEphemeralUpdates();
    }

    void commitDurableState(StateUpdates updates) {
        Map<String, StateUpdates.Transition> staged = updates.getStateUpdates();
        if (staged.isEmpty()) {
            return;
        }

        // Fresh read: the snapshot taken at evaluation time may be stale by now
        Map<String, DetectorState> existing = repository.findByGroupKeys(detectorId, staged.keySet());

        List<DetectorState> created = new ArrayList<>();
        List<DetectorState> updated = new ArrayList<>();
        for (Map.Entry<String, StateUpdates.Transition> entry : staged.entrySet()) {
            StateUpdates.Transition transition = entry.getValue();
            DetectorState row = existing.get(entry.getKey());
            if (row == null) {
                created.add(DetectorState.newRow(detectorId, entry.getKey(),
                        transition.isActive(), transition.getPriority()));
            } else if (row.differsFrom(transition.isActive(), transition.getPriority())) {
                row.setActive(transition.isActive());
                row.setState(transition.getPriority());
                updated.add(row);
            }
        }

        repository.bulkCreate(created);
        repository.bulkUpdate(updated);
        updates.clearStateUpdates();
        LOG.debug("Detector {} committed state: {} created, {} updated",
                detectorId, created.size(), updated.size());
    }

    // ---------------------------------------------------------------
    // Keys
    // ---------------------------------------------------------------

    public String buildDedupeValueKey(String groupKey) {
        return buildCounterValueKey(groupKey, DEDUPE_VALUE_SUFFIX);
    }

    public String buildCounterValueKey(String groupKey, String counterName) {
        return detectorId + ":" + (groupKey != null ? groupKey : "") + ":" + counterName;
    }

    public long getDetectorId() {
        return detectorId;
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    private static boolean isAbsent(String raw) {
        return raw == null || raw.isBlank();
    }

    private long parseLong(String raw, String groupKey) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new StateStoreException("Corrupt dedupe value '" + raw + "' for detector "
                    + detectorId + " group key '" + groupKey + "'", e);
        }
    }

    private int parseInt(String raw, String groupKey) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new StateStoreException("Corrupt counter value '" + raw + "' for detector "
                    + detectorId + " group key '" + groupKey + "'", e);
        }
    }
}
