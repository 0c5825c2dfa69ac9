package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Farm profile owned by the onboarding collaborator. Read-only inside a decision run.
 */
public record FarmProfile(
    @JsonProperty("farmerId")       long farmerId,
    @JsonProperty("landSizeAcres")  double landSizeAcres,
    @JsonProperty("irrigationType") IrrigationType irrigationType,
    @JsonProperty("location")       GeoLocation location,
    @JsonProperty("language")       String language
) {
    public FarmProfile {
        if (irrigationType == null) irrigationType = IrrigationType.RAINFED;
        if (language == null) language = "en";
    }

    @JsonIgnore
    public boolean hasLocation() {
        return location != null;
    }
}
