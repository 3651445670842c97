package com.watchtower.core.state;

import java.util.List;

/**
 * Fast expiring key-value store holding dedupe watermarks and counters.
 *
 * <p>
 * Both operations are batch requests: every call is executed as a single
 * pipeline, so the number of round trips does not grow with the number of
 * keys.
 * </p>
 *
 * @since 1.0.0
 */
public interface EphemeralStateStore {

    /**
     * Fetch several keys in one pipeline.
     *
     * @param keys keys to read
     * @return values aligned with {@code keys}; {@code null} for absent keys
     * @throws StateStoreException if the store is unavailable
     */
    List<String> getAll(List<String> keys);

    /**
     * Apply several writes in one pipeline. An empty list is a no-op.
     *
     * @param writes sets and deletes, applied in order
     * @throws StateStoreException if the store is unavailable
     */
    void writeAll(List<CacheWrite> writes);
}
