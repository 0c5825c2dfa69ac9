package com.cropadvisor.orchestrator.logger;

import com.cropadvisor.common.exception.AdvisoryException;
import com.cropadvisor.common.model.Decision;
import com.cropadvisor.common.trace.TraceContextUtil;
import com.cropadvisor.orchestrator.pipeline.RunState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Observability for the decision lifecycle. Pure side effects: nothing here changes the run.
 *
 * <p>Lifecycle moves are logged through {@link #logWithTraceId}; sub-steps inside a reactive
 * chain, such as falling back to cached weather, use {@link #stage} with {@code doOnEach}.
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);
    private static final Logger audit = LoggerFactory.getLogger("com.cropadvisor.audit");

    private final ObjectMapper objectMapper;

    public DecisionFlowLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * {@code doOnEach} consumer logging a sub-step with a detail taken from the emitted value.
     * The traceId comes from the Reactor Context and sits in MDC only during the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stepName, Function<? super T, String> detail) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            String text = detail.apply(signal.get());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] step={} {} traceId={}", stepName, text, traceId)
            );
        };
    }

    public void logWithTraceId(RunState state, String traceId, String detail) {
        TraceContextUtil.withMdc(traceId, () -> {
            if (detail == null || detail.isEmpty()) {
                log.info("[DecisionFlow] stage={} traceId={}", state, traceId);
            } else {
                log.info("[DecisionFlow] stage={} {} traceId={}", state, detail, traceId);
            }
        });
    }

    /** Advisory errors are expected outcomes and log without a stack trace. */
    public void logFailure(String traceId, Throwable cause) {
        TraceContextUtil.withMdc(traceId, () -> {
            if (cause instanceof AdvisoryException) {
                log.warn("[DecisionFlow] stage={} error={} traceId={}", RunState.FAILED, cause.getMessage(), traceId);
            } else {
                log.error("[DecisionFlow] stage={} error={} traceId={}", RunState.FAILED,
                          cause.getMessage(), traceId, cause);
            }
        });
    }

    /** Writes the finalized decision as one JSON line on the audit logger. */
    public void logDecision(Decision decision) {
        TraceContextUtil.withMdc(decision.traceId(), () -> {
            try {
                audit.info(objectMapper.writeValueAsString(decision));
            } catch (JsonProcessingException e) {
                log.warn("[DecisionFlow] Audit serialization failed traceId={} error={}",
                         decision.traceId(), e.getMessage());
            }
        });
    }
}
