/**
 * Ephemeral (Redis) and durable (relational) detector state.
 *
 * <p>
 * {@link com.watchtower.core.state.DetectorStateStore} is the per-detector
 * entry point: it merges both stores into
 * {@link com.watchtower.core.model.DetectorStateData} snapshots and flushes
 * {@link com.watchtower.core.state.StateUpdates} back to them.
 * </p>
 *
 * @since 1.0.0
 */
package com.watchtower.core.state;
