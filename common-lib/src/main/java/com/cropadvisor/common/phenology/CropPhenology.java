package com.cropadvisor.common.phenology;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Ordered stage table of one crop.
 *
 * <p>Stage {@code i} covers {@code [upper(i-1), upper(i))} with the first lower bound at 0.
 * A total at or beyond the last bound maps to the last stage with progress 1.
 * Bounds must be strictly increasing and the last one must equal
 * {@code totalGddToMaturity}; violations fail construction.
 */
public record CropPhenology(
    @JsonProperty("baseTemperature")    double baseTemperature,
    @JsonProperty("totalGddToMaturity") double totalGddToMaturity,
    @JsonProperty("stages")             List<StageBoundary> stages
) {
    private static final double EPSILON = 1e-9;

    public CropPhenology {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("stage table must not be empty");
        }
        stages = List.copyOf(stages);
        double previous = 0.0;
        for (StageBoundary stage : stages) {
            if (stage.upperGdd() <= previous) {
                throw new IllegalArgumentException("stage bounds must be strictly increasing, got "
                    + stage.upperGdd() + " after " + previous + " at stage " + stage.name());
            }
            previous = stage.upperGdd();
        }
        if (Math.abs(previous - totalGddToMaturity) > EPSILON) {
            throw new IllegalArgumentException("last stage bound " + previous
                + " does not equal totalGddToMaturity " + totalGddToMaturity);
        }
    }

    public StagePosition position(double accumulatedGdd) {
        double gdd = Math.max(0.0, accumulatedGdd);
        double overall = Math.min(1.0, gdd / totalGddToMaturity);
        double lower = 0.0;
        for (int i = 0; i < stages.size(); i++) {
            StageBoundary stage = stages.get(i);
            if (gdd < stage.upperGdd()) {
                double progress = (gdd - lower) / (stage.upperGdd() - lower);
                return new StagePosition(i, stage, lower, progress, overall, stage.upperGdd() - gdd);
            }
            lower = stage.upperGdd();
        }
        int last = stages.size() - 1;
        double lastLower = last == 0 ? 0.0 : stages.get(last - 1).upperGdd();
        return new StagePosition(last, stages.get(last), lastLower, 1.0, overall, 0.0);
    }

    public Optional<StageBoundary> stage(String name) {
        return stages.stream().filter(s -> s.name().equalsIgnoreCase(name)).findFirst();
    }

    public String initialStage() {
        return stages.get(0).name();
    }
}
