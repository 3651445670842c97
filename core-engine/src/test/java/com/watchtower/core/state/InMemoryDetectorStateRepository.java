package com.watchtower.core.state;

import com.watchtower.core.model.DetectorState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * List-backed {@link DetectorStateRepository} for tests. Hands out copies so
 * callers cannot mutate stored rows without calling
 * {@link #bulkUpdate(List)}, as with a real database.
 */
public class InMemoryDetectorStateRepository implements DetectorStateRepository {

    private final List<DetectorState> rows = new ArrayList<>();
    private long nextId = 1;
    private int findCalls;
    private int createCalls;
    private int updateCalls;
    private boolean unavailable;

    @Override
    public Map<String, DetectorState> findByGroupKeys(long detectorId, Collection<String> groupKeys) {
        checkAvailable();
        findCalls++;
        Set<String> wanted = new HashSet<>(groupKeys);
        Map<String, DetectorState> lookup = new LinkedHashMap<>();
        for (DetectorState row : rows) {
            if (row.getDetectorId() == detectorId && wanted.contains(row.getGroupKey())) {
                lookup.put(row.getGroupKey(), copy(row));
            }
        }
        return lookup;
    }

    @Override
    public void bulkCreate(List<DetectorState> states) {
        checkAvailable();
        createCalls++;
        for (DetectorState state : states) {
            DetectorState stored = copy(state);
            stored.setId(nextId++);
            rows.add(stored);
        }
    }

    @Override
    public void bulkUpdate(List<DetectorState> states) {
        checkAvailable();
        updateCalls++;
        for (DetectorState state : states) {
            for (DetectorState row : rows) {
                if (Objects.equals(row.getId(), state.getId())) {
                    row.setActive(state.isActive());
                    row.setState(state.getState());
                }
            }
        }
    }

    /**
     * Insert a row directly, bypassing call counters.
     */
    public DetectorState insert(DetectorState state) {
        DetectorState stored = copy(state);
        stored.setId(nextId++);
        rows.add(stored);
        return copy(stored);
    }

    public List<DetectorState> rows() {
        return rows.stream().map(InMemoryDetectorStateRepository::copy).toList();
    }

    public DetectorState row(long detectorId, String groupKey) {
        return rows.stream()
                .filter(r -> r.getDetectorId() == detectorId && Objects.equals(r.getGroupKey(), groupKey))
                .map(InMemoryDetectorStateRepository::copy)
                .findFirst()
                .orElse(null);
    }

    public int findCalls() {
        return findCalls;
    }

    public int createCalls() {
        return createCalls;
    }

    public int updateCalls() {
        return updateCalls;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new StateStoreException("Database unavailable");
        }
    }

    private static DetectorState copy(DetectorState state) {
        return new DetectorState(state.getId(), state.getDetectorId(), state.getGroupKey(),
                state.isActive(), state.getState());
    }
}
