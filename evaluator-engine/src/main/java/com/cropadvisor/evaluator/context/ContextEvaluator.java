package com.cropadvisor.evaluator.context;

import com.cropadvisor.common.exception.UnknownCropKindException;
import com.cropadvisor.common.model.CropKind;
import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.CropRegistration;
import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.FarmProfile;
import com.cropadvisor.common.model.Intent;
import com.cropadvisor.common.phenology.CropKnowledgeBase;
import com.cropadvisor.evaluator.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Summarises the farmer's stored context and, for the crop-onboarding intent, proposes a
 * crop registration from the NLU entities {@code crop_type}, {@code sowing_date} and
 * {@code variety}. A missing sowing date defaults to the run's day.
 */
@Component
public class ContextEvaluator implements Evaluator<FarmSnapshot, ContextReport> {

    private static final Logger log = LoggerFactory.getLogger(ContextEvaluator.class);

    public static final String ENTITY_CROP_TYPE = "crop_type";
    public static final String ENTITY_SOWING_DATE = "sowing_date";
    public static final String ENTITY_VARIETY = "variety";

    private final CropKnowledgeBase knowledgeBase;

    public ContextEvaluator(CropKnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    @Override
    public EvaluatorId id() {
        return EvaluatorId.CONTEXT;
    }

    @Override
    public Mono<ContextReport> evaluate(FarmSnapshot snapshot) {
        return Mono.fromCallable(() -> {
            String summary = summarise(snapshot);
            if (snapshot.intent() != Intent.CROP_ONBOARDING_INTENT) {
                return new ContextReport(summary, null, null, summary);
            }

            String cropType = snapshot.entities().get(ENTITY_CROP_TYPE);
            if (cropType == null || cropType.isBlank()) {
                return new ContextReport(summary, null, "crop type not given", summary + "; no crop type in request");
            }
            CropKind kind;
            try {
                kind = CropKind.fromKey(cropType);
            } catch (UnknownCropKindException e) {
                log.warn("[ContextEvaluator] Unsupported crop in onboarding request farmerId={} crop={}",
                         snapshot.farmerId(), cropType);
                return new ContextReport(summary, null, "crop '" + cropType + "' is not supported",
                                         summary + "; unsupported crop " + cropType);
            }

            LocalDate sowingDate;
            String rawDate = snapshot.entities().get(ENTITY_SOWING_DATE);
            try {
                sowingDate = rawDate == null || rawDate.isBlank() ? snapshot.asOf() : LocalDate.parse(rawDate.trim());
            } catch (DateTimeParseException e) {
                return new ContextReport(summary, null, "sowing date '" + rawDate + "' is not a valid date",
                                         summary + "; unparseable sowing date");
            }
            if (sowingDate.isAfter(snapshot.asOf())) {
                return new ContextReport(summary, null, "sowing date " + sowingDate + " is in the future",
                                         summary + "; future sowing date");
            }

            CropRegistration registration = new CropRegistration(kind, snapshot.entities().get(ENTITY_VARIETY),
                sowingDate, initialStage(kind));
            log.info("[ContextEvaluator] Proposing crop registration farmerId={} crop={} sowingDate={}",
                     snapshot.farmerId(), kind.key(), sowingDate);
            return new ContextReport(summary, registration, null,
                                     summary + "; register " + kind.key() + " sown " + sowingDate);
        });
    }

    private String initialStage(CropKind kind) {
        try {
            return knowledgeBase.phenology(kind).initialStage();
        } catch (UnknownCropKindException e) {
            return knowledgeBase.generic().initialStage();
        }
    }

    private String summarise(FarmSnapshot snapshot) {
        FarmProfile profile = snapshot.profile();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%.1f acres, %s irrigation", profile.landSizeAcres(),
                                profile.irrigationType().key()));
        if (profile.hasLocation() && profile.location().name() != null) {
            sb.append(", ").append(profile.location().name());
        }
        CropRecord crop = snapshot.activeCrop();
        if (crop == null) {
            sb.append(", no active crop");
        } else {
            sb.append(String.format(Locale.ROOT, ", %s at %s (%.0f%% to maturity)", crop.cropKind() == null ? "unknown crop" : crop.cropKind().key(),
                                    crop.stage(), crop.overallProgress() * 100));
            if (crop.sowingDate() != null) {
                sb.append(", day ").append(crop.daysSinceSowing(snapshot.asOf())).append(" after sowing");
            }
        }
        return sb.toString();
    }
}
