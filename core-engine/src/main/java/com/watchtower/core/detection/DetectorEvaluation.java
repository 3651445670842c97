package com.watchtower.core.detection;

import com.watchtower.core.model.DetectorEvaluationResult;
import com.watchtower.core.state.StateUpdates;

import java.util.List;
import java.util.Objects;

/**
 * What one {@link DetectorHandler#evaluate} call produced: the results to
 * hand downstream and the updates to commit afterwards.
 *
 * @since 1.0.0
 */
public final class DetectorEvaluation {

    private final List<DetectorEvaluationResult> results;
    private final StateUpdates stateUpdates;

    public DetectorEvaluation(List<DetectorEvaluationResult> results, StateUpdates stateUpdates) {
        this.results = List.copyOf(Objects.requireNonNull(results, "results must not be null"));
        this.stateUpdates = Objects.requireNonNull(stateUpdates, "stateUpdates must not be null");
    }

    /**
     * @return state transitions, in group-key iteration order
     */
    public List<DetectorEvaluationResult> getResults() {
        return results;
    }

    /**
     * @return staged updates; drained by commit
     */
    public StateUpdates getStateUpdates() {
        return stateUpdates;
    }

    @Override
    public String toString() {
        return "DetectorEvaluation{results=" + results + ", stateUpdates=" + stateUpdates + '}';
    }
}
