package com.cropadvisor.orchestrator.pipeline;

import com.cropadvisor.orchestrator.logger.DecisionFlowLogger;

/**
 * Tracks the lifecycle state of a single run and logs every transition.
 * One instance per request; operators of one run execute sequentially.
 */
public final class OrchestrationRun {

    private final String traceId;
    private final DecisionFlowLogger flowLogger;
    private volatile RunState state = RunState.RECEIVED;

    public OrchestrationRun(String traceId, DecisionFlowLogger flowLogger) {
        this.traceId = traceId;
        this.flowLogger = flowLogger;
        flowLogger.logWithTraceId(RunState.RECEIVED, traceId, "");
    }

    /**
     * @throws IllegalStateException when {@code next} is not a legal successor
     */
    public void moveTo(RunState next, String detail) {
        RunState current = state;
        if (!current.canMoveTo(next)) {
            throw new IllegalStateException("illegal run transition " + current + " -> " + next
                                            + " traceId=" + traceId);
        }
        state = next;
        flowLogger.logWithTraceId(next, traceId, detail);
    }

    /** Marks the run failed unless it already reached a terminal state. */
    public void fail(Throwable cause) {
        if (state.isTerminal()) return;
        state = RunState.FAILED;
        flowLogger.logFailure(traceId, cause);
    }

    public RunState state() {
        return state;
    }

    public String traceId() {
        return traceId;
    }
}
