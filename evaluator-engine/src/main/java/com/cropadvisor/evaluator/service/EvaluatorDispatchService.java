package com.cropadvisor.evaluator.service;

import com.cropadvisor.common.exception.DataUnavailableException;
import com.cropadvisor.common.trace.TraceContextUtil;
import com.cropadvisor.evaluator.Evaluator;
import com.cropadvisor.evaluator.EvaluatorOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Runs one evaluator under its own deadline and folds every failure into an
 * unavailable {@link EvaluatorOutcome}. The returned Mono never errors.
 */
@Service
public class EvaluatorDispatchService {

    private static final Logger log = LoggerFactory.getLogger(EvaluatorDispatchService.class);

    public <I, O> Mono<EvaluatorOutcome<O>> dispatch(Evaluator<I, O> evaluator, I input, Duration deadline) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            long start = System.nanoTime();
            return Mono.defer(() -> evaluator.evaluate(input))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(deadline)
                .map(report -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    TraceContextUtil.withMdc(traceId, () ->
                        log.info("Evaluator={} complete. elapsedMs={} traceId={}",
                                 evaluator.id().displayName(), elapsed.toMillis(), traceId));
                    return EvaluatorOutcome.available(evaluator.id(), report, elapsed);
                })
                .onErrorResume(e -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    String reason = describe(e, deadline);
                    TraceContextUtil.withMdc(traceId, () -> {
                        if (e instanceof TimeoutException || e instanceof DataUnavailableException) {
                            log.warn("Evaluator={} unavailable. reason={} traceId={}",
                                     evaluator.id().displayName(), reason, traceId);
                        } else {
                            log.error("Evaluator={} failed. traceId={}", evaluator.id().displayName(), traceId, e);
                        }
                    });
                    return Mono.just(EvaluatorOutcome.<O>unavailable(evaluator.id(), reason, elapsed));
                });
        });
    }

    private static String describe(Throwable e, Duration deadline) {
        if (e instanceof TimeoutException) {
            return "timed out after " + deadline.toMillis() + "ms";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
