package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weather translated into farming terms. Risks are in [0.0, 1.0].
 */
public record FarmingImpact(
    @JsonProperty("rainRisk")         double rainRisk,
    @JsonProperty("heatStressRisk")   double heatStressRisk,
    @JsonProperty("spraySafe")        boolean spraySafe,
    @JsonProperty("irrigationNeeded") boolean irrigationNeeded,
    @JsonProperty("fieldWorkSafe")    boolean fieldWorkSafe,
    @JsonProperty("reasoning")        String reasoning
) {}
