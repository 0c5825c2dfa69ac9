package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Proposed change to a {@link CropRecord}, produced by the crop-stage evaluator and
 * committed only by the orchestrator.
 */
public record CropDelta(
    @JsonProperty("accumulatedGdd")  double accumulatedGdd,
    @JsonProperty("gddCheckpoint")   LocalDate gddCheckpoint,
    @JsonProperty("stage")           String stage,
    @JsonProperty("stageProgress")   double stageProgress,
    @JsonProperty("overallProgress") double overallProgress
) {}
