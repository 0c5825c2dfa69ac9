package com.cropadvisor.evaluator.cropstage;

import com.cropadvisor.common.model.CropDelta;
import com.cropadvisor.common.model.CropKind;
import com.cropadvisor.common.model.CropPhase;
import com.cropadvisor.common.model.WaterNeed;
import com.cropadvisor.common.phenology.StagePosition;

/**
 * Crop-stage evaluation result.
 *
 * @param proposedDelta          present only when new days were folded into the GDD total
 * @param genericFallback        the crop had no knowledge-base entry; the generic curve was used
 * @param gddStale               temperature history was unavailable, GDD was not advanced
 * @param estimatedDaysToMaturity {@code null} when no growth has been recorded yet
 */
public record CropStageReport(
    CropKind cropKind,
    double accumulatedGdd,
    StagePosition position,
    CropDelta proposedDelta,
    boolean genericFallback,
    boolean gddStale,
    int daysSinceSowing,
    Integer estimatedDaysToMaturity,
    String justification
) {
    public String stage() {
        return position.stageName();
    }

    public WaterNeed waterNeed() {
        return position.stage().waterNeed();
    }

    public CropPhase phase() {
        return position.stage().phase();
    }

    public boolean heatSensitive() {
        return position.stage().heatSensitive();
    }

    public boolean hasDelta() {
        return proposedDelta != null;
    }
}
