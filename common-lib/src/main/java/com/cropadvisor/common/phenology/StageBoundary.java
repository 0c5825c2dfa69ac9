package com.cropadvisor.common.phenology;

import com.cropadvisor.common.model.CropPhase;
import com.cropadvisor.common.model.WaterNeed;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of a crop's stage table: the stage ends (exclusive) at {@code upperGdd}.
 */
public record StageBoundary(
    @JsonProperty("name")          String name,
    @JsonProperty("upperGdd")      double upperGdd,
    @JsonProperty("waterNeed")     WaterNeed waterNeed,
    @JsonProperty("heatSensitive") boolean heatSensitive,
    @JsonProperty("phase")         CropPhase phase,
    @JsonProperty("description")   String description
) {
    public StageBoundary {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stage name is required");
        }
        if (waterNeed == null) waterNeed = WaterNeed.MEDIUM;
        if (phase == null) phase = CropPhase.VEGETATIVE;
        if (description == null) description = "";
    }
}
