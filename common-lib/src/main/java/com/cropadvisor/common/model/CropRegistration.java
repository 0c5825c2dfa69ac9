package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * A new crop to register for a farmer, either from the onboarding endpoint or proposed by
 * the context evaluator from chat entities. Registering supersedes the active crop.
 */
public record CropRegistration(
    @JsonProperty("cropKind")     CropKind cropKind,
    @JsonProperty("variety")      String variety,
    @JsonProperty("sowingDate")   LocalDate sowingDate,
    @JsonProperty("initialStage") String initialStage
) {}
