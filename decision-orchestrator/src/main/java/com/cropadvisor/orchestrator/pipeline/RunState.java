package com.cropadvisor.orchestrator.pipeline;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one decision run. {@code FINALIZED} and {@code FAILED} are terminal;
 * {@code FAILED} is reachable from every non-terminal state.
 */
public enum RunState {
    RECEIVED,
    CONTEXT_LOADED,
    EVALUATORS_DISPATCHED,
    MERGED,
    FINALIZED,
    FAILED;

    public boolean isTerminal() {
        return this == FINALIZED || this == FAILED;
    }

    public Set<RunState> successors() {
        switch (this) {
            case RECEIVED:              return EnumSet.of(CONTEXT_LOADED, FAILED);
            case CONTEXT_LOADED:        return EnumSet.of(EVALUATORS_DISPATCHED, FAILED);
            case EVALUATORS_DISPATCHED: return EnumSet.of(MERGED, FAILED);
            case MERGED:                return EnumSet.of(FINALIZED, FAILED);
            default:                    return EnumSet.noneOf(RunState.class);
        }
    }

    public boolean canMoveTo(RunState next) {
        return successors().contains(next);
    }
}
