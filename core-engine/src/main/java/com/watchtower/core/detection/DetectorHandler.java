package com.watchtower.core.detection;

import com.watchtower.core.model.DataPacket;
import com.watchtower.core.model.Detector;

/**
 * Contract for all detector handlers.
 * <p>
 * A handler is bound to one {@link Detector} and decides, for every group
 * key present in a {@link DataPacket}, whether the detector's state changed.
 * Evaluation never writes to the state stores: it stages updates in the
 * returned {@link DetectorEvaluation}, and nothing is persisted until
 * {@link #commitStateUpdates(DetectorEvaluation)} is called with it.
 * </p>
 * <p>
 * Handlers hold no per-evaluation mutable state, so one instance may serve
 * many evaluations; each {@link DetectorEvaluation} must stay on one thread.
 * </p>
 *
 * @param <T> payload type of the packets this handler understands
 */
public interface DetectorHandler<T> {

    /**
     * Evaluate a data packet.
     *
     * @param packet the incoming packet
     * @return results for changed group keys plus the staged updates
     * @throws com.watchtower.core.state.StateStoreException if state cannot be read
     */
    DetectorEvaluation evaluate(DataPacket<T> packet);

    /**
     * Persist the updates staged by an earlier {@link #evaluate} call.
     *
     * @param evaluation the evaluation to commit
     * @throws com.watchtower.core.state.StateStoreException if state cannot be written
     */
    void commitStateUpdates(DetectorEvaluation evaluation);

    /**
     * @return the detector this handler evaluates
     */
    Detector getDetector();
}
