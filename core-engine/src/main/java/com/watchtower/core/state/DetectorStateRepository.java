package com.watchtower.core.state;

import com.watchtower.core.model.DetectorState;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Durable store of {@link DetectorState} rows, at most one per
 * {@code (detector, group key)}.
 *
 * <p>
 * Rows are never deleted here; their lifecycle is managed elsewhere.
 * Concurrent writers are resolved last-write-wins.
 * </p>
 *
 * @since 1.0.0
 */
public interface DetectorStateRepository {

    /**
     * Fetch the rows of one detector for the given group keys in a single
     * query. A {@code null} entry in {@code groupKeys} matches the "no group"
     * row.
     *
     * @return rows keyed by group key; keys without a row are absent
     * @throws StateStoreException if the store is unavailable
     */
    Map<String, DetectorState> findByGroupKeys(long detectorId, Collection<String> groupKeys);

    /**
     * Insert new rows in one batch. An empty list is a no-op.
     *
     * @throws StateStoreException if the store is unavailable
     */
    void bulkCreate(List<DetectorState> states);

    /**
     * Update {@code active} and {@code state} of existing rows (matched by id)
     * in one batch. An empty list is a no-op.
     *
     * @throws StateStoreException if the store is unavailable
     */
    void bulkUpdate(List<DetectorState> states);
}
