package com.cropadvisor.evaluator.cropstage;

import com.cropadvisor.common.exception.DataUnavailableException;
import com.cropadvisor.common.exception.UnknownCropKindException;
import com.cropadvisor.common.gdd.GddAccumulation;
import com.cropadvisor.common.gdd.GddCalculator;
import com.cropadvisor.common.model.CropDelta;
import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.DailyTemperature;
import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.phenology.CropKnowledgeBase;
import com.cropadvisor.common.phenology.CropPhenology;
import com.cropadvisor.common.phenology.StagePosition;
import com.cropadvisor.evaluator.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Advances a crop's growing-degree-day total with the days since its checkpoint and locates
 * the result in the crop's stage table.
 *
 * <p>Returns a proposed {@link CropDelta}; the crop record itself is never written here.
 * A missing temperature history is not fatal: the stage is derived from the stored total
 * and the report is flagged {@code gddStale}. The history call has its own timeout, which
 * must stay below the crop-stage dispatch deadline or the stale fallback never gets to run.
 */
@Component
public class CropStageEvaluator implements Evaluator<CropStageInput, CropStageReport> {

    private static final Logger log = LoggerFactory.getLogger(CropStageEvaluator.class);

    public static final Duration DEFAULT_HISTORY_TIMEOUT = Duration.ofMillis(2500);

    private final CropKnowledgeBase knowledgeBase;
    private final TemperatureHistorySource history;
    private final Duration historyTimeout;

    public CropStageEvaluator(CropKnowledgeBase knowledgeBase, TemperatureHistorySource history) {
        this(knowledgeBase, history, DEFAULT_HISTORY_TIMEOUT);
    }

    @Autowired
    public CropStageEvaluator(CropKnowledgeBase knowledgeBase, TemperatureHistorySource history,
                              @Value("${services.open-meteo.history-timeout-ms:2500}") long historyTimeoutMs) {
        this(knowledgeBase, history, Duration.ofMillis(historyTimeoutMs));
    }

    public CropStageEvaluator(CropKnowledgeBase knowledgeBase, TemperatureHistorySource history,
                              Duration historyTimeout) {
        if (historyTimeout.isNegative() || historyTimeout.isZero()) {
            throw new IllegalArgumentException("historyTimeout must be positive: " + historyTimeout);
        }
        this.knowledgeBase = knowledgeBase;
        this.history = history;
        this.historyTimeout = historyTimeout;
    }

    public Duration historyTimeout() {
        return historyTimeout;
    }

    @Override
    public EvaluatorId id() {
        return EvaluatorId.CROP_STAGE;
    }

    @Override
    public Mono<CropStageReport> evaluate(CropStageInput input) {
        CropRecord crop = input.crop();
        if (crop == null || !crop.isComplete()) {
            return Mono.error(new DataUnavailableException(id().displayName(),
                "crop record is incomplete: sowing date unknown"));
        }

        boolean genericFallback = false;
        CropPhenology phenology;
        try {
            phenology = knowledgeBase.phenology(crop.cropKind());
        } catch (UnknownCropKindException e) {
            log.warn("[CropStageEvaluator] No phenology for crop={} cropId={}, using generic curve",
                     e.getCropKey(), crop.cropId());
            phenology = knowledgeBase.generic();
            genericFallback = true;
        }

        final CropPhenology curve = phenology;
        final boolean fallback = genericFallback;
        LocalDate from = crop.nextGddDay();
        LocalDate to = input.asOf().minusDays(1);

        if (from.isAfter(to)) {
            return Mono.just(build(crop, curve, fallback, null, false, input.asOf()));
        }
        if (input.location() == null) {
            log.warn("[CropStageEvaluator] No location for cropId={}, GDD not advanced", crop.cropId());
            return Mono.just(build(crop, curve, fallback, null, true, input.asOf()));
        }

        return history.dailyTemperatures(input.location(), from, to)
            .timeout(historyTimeout)
            .map(days -> build(crop, curve, fallback, days, false, input.asOf()))
            .onErrorResume(e -> {
                log.warn("[CropStageEvaluator] Temperature history unavailable cropId={} from={} to={} reason={}",
                         crop.cropId(), from, to, e.getMessage());
                return Mono.just(build(crop, curve, fallback, null, true, input.asOf()));
            });
    }

    private CropStageReport build(CropRecord crop, CropPhenology phenology, boolean genericFallback,
                                  List<DailyTemperature> days, boolean gddStale, LocalDate asOf) {
        double gdd = crop.accumulatedGdd();
        CropDelta delta = null;
        int newDays = 0;

        if (days != null) {
            GddAccumulation acc = GddCalculator.accumulate(gdd, crop.gddCheckpoint(), days,
                                                           phenology.baseTemperature());
            if (acc.advanced()) {
                gdd = acc.accumulatedGdd();
                newDays = acc.daysCounted();
                StagePosition advanced = phenology.position(gdd);
                delta = new CropDelta(gdd, acc.checkpoint(), advanced.stageName(),
                                      advanced.stageProgress(), advanced.overallProgress());
            }
        }

        StagePosition position = phenology.position(gdd);
        int daysSinceSowing = crop.daysSinceSowing(asOf);
        double average = GddCalculator.averageDailyGdd(gdd, daysSinceSowing);
        OptionalInt remaining = gdd <= 0 ? OptionalInt.empty()
            : GddCalculator.daysToTarget(gdd, phenology.totalGddToMaturity(), average);
        Integer daysToMaturity = remaining.isPresent() ? remaining.getAsInt() : null;

        String justification = String.format(Locale.ROOT,
            "%s at %s (%.0f%% through stage, %.0f%% to maturity), GDD %.1f%s%s%s",
            crop.cropKind().key(), position.stageName(), position.stageProgress() * 100,
            position.overallProgress() * 100, gdd,
            newDays > 0 ? " (+" + newDays + " days)" : "",
            gddStale ? ", temperature history unavailable" : "",
            genericFallback ? ", generic growth curve" : "");

        log.info("[CropStageEvaluator] cropId={} stage={} gdd={} newDays={} stale={} fallback={}",
                 crop.cropId(), position.stageName(), gdd, newDays, gddStale, genericFallback);

        return new CropStageReport(crop.cropKind(), gdd, position, delta, genericFallback, gddStale,
                                   daysSinceSowing, daysToMaturity, justification);
    }
}
