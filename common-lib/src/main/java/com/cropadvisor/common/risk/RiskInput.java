package com.cropadvisor.common.risk;

import com.cropadvisor.common.model.CropPhase;
import com.cropadvisor.common.model.FarmingImpact;
import com.cropadvisor.common.model.IrrigationType;
import com.cropadvisor.common.model.WaterNeed;

import java.time.Instant;

/**
 * Everything a risk rule may look at. {@code impact} is {@code null} when no weather
 * (live or cached) was available for the run.
 */
public record RiskInput(
    String stage,
    CropPhase phase,
    WaterNeed waterNeed,
    FarmingImpact impact,
    int daysSinceSowing,
    IrrigationType irrigationType,
    Instant asOf
) {
    public boolean hasWeather() {
        return impact != null;
    }

    public boolean isFloweringClass() {
        return phase == CropPhase.FLOWERING;
    }

    public boolean isMaturityClass() {
        return phase == CropPhase.MATURATION;
    }

    /** Establishment and vegetative phases both count as vegetative growth for risk purposes. */
    public boolean isVegetativeClass() {
        return phase == CropPhase.ESTABLISHMENT || phase == CropPhase.VEGETATIVE;
    }
}
