package com.cropadvisor.orchestrator.service;

import com.cropadvisor.common.exception.CommitConflictException;
import com.cropadvisor.common.exception.ProfileIncompleteException;
import com.cropadvisor.common.model.CropDelta;
import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.Decision;
import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.FarmProfile;
import com.cropadvisor.common.model.Intent;
import com.cropadvisor.common.model.IntentRequest;
import com.cropadvisor.common.model.WeatherSnapshot;
import com.cropadvisor.common.risk.RiskInput;
import com.cropadvisor.common.trace.TraceContextUtil;
import com.cropadvisor.evaluator.EvaluatorOutcome;
import com.cropadvisor.evaluator.context.ContextEvaluator;
import com.cropadvisor.evaluator.context.FarmSnapshot;
import com.cropadvisor.evaluator.cropstage.CropStageEvaluator;
import com.cropadvisor.evaluator.cropstage.CropStageInput;
import com.cropadvisor.evaluator.cropstage.CropStageReport;
import com.cropadvisor.evaluator.risk.RiskEvaluator;
import com.cropadvisor.evaluator.service.EvaluatorDispatchService;
import com.cropadvisor.evaluator.weather.WeatherEvaluator;
import com.cropadvisor.evaluator.weather.WeatherReport;
import com.cropadvisor.orchestrator.config.AdvisorProperties;
import com.cropadvisor.orchestrator.context.ContextStore;
import com.cropadvisor.orchestrator.logger.DecisionFlowLogger;
import com.cropadvisor.orchestrator.pipeline.DecisionPipelineEngine;
import com.cropadvisor.orchestrator.pipeline.EvaluationBundle;
import com.cropadvisor.orchestrator.pipeline.OrchestrationRun;
import com.cropadvisor.orchestrator.pipeline.RunState;
import com.cropadvisor.orchestrator.routing.IntentRoute;
import com.cropadvisor.orchestrator.routing.IntentRoutingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one intent through the decision lifecycle.
 *
 * <ol>
 *   <li>RECEIVED: intent resolved against the routing table</li>
 *   <li>CONTEXT_LOADED: profile and active crop read once into a {@link FarmSnapshot}</li>
 *   <li>EVALUATORS_DISPATCHED: wave 1 (Weather, Crop-Stage, Context) in parallel, then
 *       wave 2 (Risk) fed from wave-1 outputs</li>
 *   <li>MERGED / FINALIZED: outcomes merged into an immutable {@link Decision}</li>
 * </ol>
 *
 * After FINALIZED the proposed crop delta or registration is written, and the decision is
 * logged as the audit record.
 */
@Service
public class DecisionOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(DecisionOrchestratorService.class);

    static final String COMMIT_CONFLICT_ALERT =
        "Your crop progress could not be saved this time; it will be updated on your next message.";
    static final String WEATHER_FROM_CACHE = "WEATHER_FROM_CACHE";
    static final String REGISTRATION_FAILED_ALERT =
        "Your crop could not be registered right now. Please try again.";

    private final IntentRoutingTable routingTable;
    private final ContextStore contextStore;
    private final EvaluatorDispatchService dispatchService;
    private final WeatherEvaluator weatherEvaluator;
    private final CropStageEvaluator cropStageEvaluator;
    private final RiskEvaluator riskEvaluator;
    private final ContextEvaluator contextEvaluator;
    private final DecisionPipelineEngine pipelineEngine;
    private final DecisionFlowLogger decisionFlowLogger;
    private final AdvisorProperties properties;
    private final Clock clock;

    public DecisionOrchestratorService(
            IntentRoutingTable routingTable,
            ContextStore contextStore,
            EvaluatorDispatchService dispatchService,
            WeatherEvaluator weatherEvaluator,
            CropStageEvaluator cropStageEvaluator,
            RiskEvaluator riskEvaluator,
            ContextEvaluator contextEvaluator,
            DecisionPipelineEngine pipelineEngine,
            DecisionFlowLogger decisionFlowLogger,
            AdvisorProperties properties,
            Clock clock) {
        Duration cropStageDeadline = properties.getDeadlines().getCropStage();
        if (cropStageEvaluator.historyTimeout().compareTo(cropStageDeadline) >= 0) {
            throw new IllegalStateException("temperature history timeout " + cropStageEvaluator.historyTimeout()
                + " must be shorter than the crop-stage deadline " + cropStageDeadline);
        }
        this.routingTable       = routingTable;
        this.contextStore       = contextStore;
        this.dispatchService    = dispatchService;
        this.weatherEvaluator   = weatherEvaluator;
        this.cropStageEvaluator = cropStageEvaluator;
        this.riskEvaluator      = riskEvaluator;
        this.contextEvaluator   = contextEvaluator;
        this.pipelineEngine     = pipelineEngine;
        this.decisionFlowLogger = decisionFlowLogger;
        this.properties         = properties;
        this.clock              = clock;
    }

    /**
     * Errors with {@code UnsupportedIntentException} or {@code ProfileIncompleteException}
     * when the run cannot start; every evaluator failure is absorbed into the decision.
     */
    public Mono<DecisionOutcome> decide(IntentRequest request, String traceId) {
        Mono<DecisionOutcome> pipeline = Mono.defer(() -> {
            OrchestrationRun run = new OrchestrationRun(traceId, decisionFlowLogger);
            return Mono.defer(() -> {
                    Intent intent = Intent.fromWire(request.intent());
                    IntentRoute route = routingTable.route(intent);
                    if (request.farmerId() == null) {
                        return Mono.error(new ProfileIncompleteException(null, "farmer id"));
                    }
                    return loadSnapshot(request.farmerId(), intent, request)
                        .flatMap(snapshot -> evaluate(run, route, snapshot));
                })
                .flatMap(bundle -> finalizeDecision(run, bundle))
                .doOnError(run::fail);
        });
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    private Mono<FarmSnapshot> loadSnapshot(long farmerId, Intent intent, IntentRequest request) {
        return Mono.zip(
                contextStore.getFarmProfile(farmerId).map(Optional::of).defaultIfEmpty(Optional.empty()),
                contextStore.getActiveCrop(farmerId).map(Optional::of).defaultIfEmpty(Optional.empty()))
            .map(t -> new FarmSnapshot(farmerId, t.getT1().orElse(null), t.getT2().orElse(null),
                                       intent, request.entities(), LocalDate.now(clock)));
    }

    private Mono<EvaluationBundle> evaluate(OrchestrationRun run, IntentRoute route, FarmSnapshot snapshot) {
        checkPrerequisites(route, snapshot);
        run.moveTo(RunState.CONTEXT_LOADED, "farmerId=" + snapshot.farmerId()
                   + " activeCrop=" + (snapshot.hasActiveCrop() ? snapshot.activeCrop().cropId() : "none"));

        Set<EvaluatorId> effective = effectiveEvaluators(route, snapshot);
        run.moveTo(RunState.EVALUATORS_DISPATCHED, "evaluators=" + effective.stream()
            .map(EvaluatorId::displayName).collect(Collectors.joining(",")));

        List<Mono<? extends EvaluatorOutcome<?>>> wave1 = new ArrayList<>();
        if (effective.contains(EvaluatorId.WEATHER)) {
            wave1.add(weatherWithFallback(snapshot));
        }
        if (effective.contains(EvaluatorId.CROP_STAGE)) {
            wave1.add(dispatchCropStage(snapshot.activeCrop(), snapshot));
        }
        if (effective.contains(EvaluatorId.CONTEXT)) {
            wave1.add(dispatchService.dispatch(contextEvaluator, snapshot,
                                               properties.getDeadlines().forEvaluator(EvaluatorId.CONTEXT)));
        }

        return Mono.zip(wave1, results -> {
                Map<EvaluatorId, EvaluatorOutcome<?>> outcomes = new EnumMap<>(EvaluatorId.class);
                for (Object result : results) {
                    EvaluatorOutcome<?> outcome = (EvaluatorOutcome<?>) result;
                    outcomes.put(outcome.id(), outcome);
                }
                return new EvaluationBundle(snapshot, route, outcomes);
            })
            .flatMap(bundle -> effective.contains(EvaluatorId.RISK) ? dispatchRisk(bundle) : Mono.just(bundle));
    }

    private void checkPrerequisites(IntentRoute route, FarmSnapshot snapshot) {
        if (snapshot.profile() == null) {
            throw new ProfileIncompleteException(snapshot.farmerId(), "farm profile");
        }
        if (route.needsCrop() && !snapshot.hasActiveCrop()) {
            throw new ProfileIncompleteException(snapshot.farmerId(), "active crop");
        }
        if (route.needsLocation() && !snapshot.profile().hasLocation()) {
            throw new ProfileIncompleteException(snapshot.farmerId(), "farm location");
        }
    }

    /** Drops evaluators whose input the snapshot cannot provide. */
    private static Set<EvaluatorId> effectiveEvaluators(IntentRoute route, FarmSnapshot snapshot) {
        EnumSet<EvaluatorId> effective = EnumSet.copyOf(route.evaluators());
        if (!snapshot.profile().hasLocation()) {
            effective.remove(EvaluatorId.WEATHER);
        }
        if (!snapshot.hasActiveCrop()) {
            effective.remove(EvaluatorId.CROP_STAGE);
            effective.remove(EvaluatorId.RISK);
        }
        return effective;
    }

    private Mono<EvaluatorOutcome<WeatherReport>> weatherWithFallback(FarmSnapshot snapshot) {
        FarmProfile profile = snapshot.profile();
        return dispatchService.dispatch(weatherEvaluator, profile.location(),
                                        properties.getDeadlines().forEvaluator(EvaluatorId.WEATHER))
            .flatMap(live -> {
                if (live.isAvailable()) {
                    cacheWeather(snapshot.farmerId(), live.report().snapshot());
                    return Mono.just(live);
                }
                return cachedWeather(snapshot.farmerId(), live);
            });
    }

    private Mono<EvaluatorOutcome<WeatherReport>> cachedWeather(long farmerId, EvaluatorOutcome<WeatherReport> live) {
        Duration staleness = properties.getWeather().getStaleness();
        return contextStore.lastWeather(farmerId)
            .filter(cached -> cached.ageAt(clock.instant()).compareTo(staleness) <= 0)
            .doOnEach(decisionFlowLogger.stage(WEATHER_FROM_CACHE, (WeatherSnapshot cached) -> "farmerId=" + farmerId
                + " fetchedAt=" + cached.fetchedAt() + " liveReason=" + live.unavailableReason()))
            .map(cached -> EvaluatorOutcome.available(EvaluatorId.WEATHER, weatherEvaluator.fromCached(cached),
                                                      live.elapsed()))
            .defaultIfEmpty(live)
            .onErrorResume(e -> {
                log.warn("Weather cache read failed. farmerId={} error={}", farmerId, e.getMessage());
                return Mono.just(live);
            });
    }

    private void cacheWeather(long farmerId, WeatherSnapshot weather) {
        contextStore.cacheWeather(farmerId, weather)
            .subscribe(
                ignored -> { },
                err -> log.warn("Weather cache write failed (non-critical). farmerId={}", farmerId, err)
            );
    }

    private Mono<EvaluatorOutcome<CropStageReport>> dispatchCropStage(CropRecord crop, FarmSnapshot snapshot) {
        CropStageInput input = new CropStageInput(crop, snapshot.profile().location(), snapshot.asOf());
        return dispatchService.dispatch(cropStageEvaluator, input,
                                        properties.getDeadlines().forEvaluator(EvaluatorId.CROP_STAGE));
    }

    /** Wave 2: Risk is fed from the crop-stage and weather outcomes of wave 1. */
    private Mono<EvaluationBundle> dispatchRisk(EvaluationBundle bundle) {
        if (!bundle.available(EvaluatorId.CROP_STAGE)) {
            return Mono.just(bundle.with(
                EvaluatorOutcome.unavailable(EvaluatorId.RISK, "crop stage unavailable", Duration.ZERO)));
        }
        CropStageReport stage = bundle.cropStageReport();
        FarmSnapshot snapshot = bundle.snapshot();
        RiskInput input = new RiskInput(
            stage.stage(), stage.phase(), stage.waterNeed(),
            bundle.available(EvaluatorId.WEATHER) ? bundle.weatherReport().impact() : null,
            stage.daysSinceSowing(), snapshot.profile().irrigationType(), clock.instant());
        return dispatchService.dispatch(riskEvaluator, input, properties.getDeadlines().forEvaluator(EvaluatorId.RISK))
            .map(bundle::with);
    }

    private Mono<DecisionOutcome> finalizeDecision(OrchestrationRun run, EvaluationBundle bundle) {
        long available = bundle.dispatchedIds().stream().filter(bundle::available).count();
        run.moveTo(RunState.MERGED, "available=" + available + "/" + bundle.dispatchedIds().size());

        Decision decision = pipelineEngine.buildDecision(bundle, run.traceId(), clock.instant());
        run.moveTo(RunState.FINALIZED, "action=" + decision.action() + " confidence=" + decision.confidence());

        return persist(decision, bundle)
            .doOnNext(outcome -> {
                log.info("Decision complete. farmerId={} action={} commit={} traceId={}",
                         decision.farmerId(), decision.action(), outcome.commitStatus(), decision.traceId());
                decisionFlowLogger.logDecision(outcome.decision());
            });
    }

    private Mono<DecisionOutcome> persist(Decision decision, EvaluationBundle bundle) {
        FarmSnapshot snapshot = bundle.snapshot();
        if (bundle.available(EvaluatorId.CROP_STAGE) && bundle.cropStageReport().hasDelta()) {
            return commitWithRetry(snapshot, bundle.cropStageReport().proposedDelta())
                .map(status -> status == CommitStatus.CONFLICT || status == CommitStatus.FAILED
                    ? new DecisionOutcome(decision.withExtraAlert(COMMIT_CONFLICT_ALERT), status)
                    : new DecisionOutcome(decision, status));
        }
        if (bundle.available(EvaluatorId.CONTEXT) && bundle.contextReport().hasRegistration()) {
            return contextStore.registerCrop(snapshot.farmerId(), bundle.contextReport().proposedRegistration())
                .map(crop -> new DecisionOutcome(decision, CommitStatus.REGISTERED))
                .onErrorResume(e -> {
                    log.error("Crop registration failed. farmerId={} traceId={}",
                              snapshot.farmerId(), decision.traceId(), e);
                    return Mono.just(new DecisionOutcome(decision.withExtraAlert(REGISTRATION_FAILED_ALERT),
                                                         CommitStatus.FAILED));
                });
        }
        return Mono.just(new DecisionOutcome(decision, CommitStatus.NONE));
    }

    /**
     * Commits against the snapshot's version. On conflict the crop is re-read, the
     * Crop-Stage Evaluator re-run on the fresh record and the commit retried once.
     */
    private Mono<CommitStatus> commitWithRetry(FarmSnapshot snapshot, CropDelta delta) {
        long farmerId = snapshot.farmerId();
        return contextStore.commitCropDelta(farmerId, delta, snapshot.activeCrop().version())
            .map(committed -> CommitStatus.COMMITTED)
            .onErrorResume(CommitConflictException.class, conflict -> {
                log.warn("Crop commit conflict, retrying. farmerId={} expectedVersion={} actualVersion={}",
                         farmerId, conflict.getExpectedVersion(), conflict.getActualVersion());
                return retryCommit(snapshot);
            })
            .onErrorResume(e -> {
                log.error("Crop commit failed. farmerId={}", farmerId, e);
                return Mono.just(CommitStatus.FAILED);
            });
    }

    private Mono<CommitStatus> retryCommit(FarmSnapshot snapshot) {
        long farmerId = snapshot.farmerId();
        return contextStore.getActiveCrop(farmerId)
            .flatMap(fresh -> dispatchCropStage(fresh, snapshot)
                .flatMap(outcome -> {
                    if (!outcome.isAvailable()) {
                        log.warn("Crop stage unavailable on retry. farmerId={} reason={}",
                                 farmerId, outcome.unavailableReason());
                        return Mono.just(CommitStatus.CONFLICT);
                    }
                    if (!outcome.report().hasDelta()) {
                        return Mono.just(CommitStatus.UP_TO_DATE);
                    }
                    return contextStore.commitCropDelta(farmerId, outcome.report().proposedDelta(), fresh.version())
                        .map(committed -> CommitStatus.COMMITTED_AFTER_RETRY)
                        .onErrorResume(CommitConflictException.class, second -> {
                            log.warn("Crop commit conflict on retry; giving up. farmerId={} actualVersion={}",
                                     farmerId, second.getActualVersion());
                            return Mono.just(CommitStatus.CONFLICT);
                        });
                }))
            .defaultIfEmpty(CommitStatus.CONFLICT);
    }
}
