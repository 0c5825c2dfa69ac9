package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Persistent state of one crop instance.
 *
 * <p>{@code accumulatedGdd} only ever grows. {@code gddCheckpoint} is the last calendar day
 * already folded into it ({@code null} until the first update). {@code version} is the
 * optimistic-concurrency token compared by the context store on every commit.
 */
public record CropRecord(
    @JsonProperty("cropId")          long cropId,
    @JsonProperty("farmerId")        long farmerId,
    @JsonProperty("cropKind")        CropKind cropKind,
    @JsonProperty("variety")         String variety,
    @JsonProperty("sowingDate")      LocalDate sowingDate,
    @JsonProperty("accumulatedGdd")  double accumulatedGdd,
    @JsonProperty("gddCheckpoint")   LocalDate gddCheckpoint,
    @JsonProperty("stage")           String stage,
    @JsonProperty("stageProgress")   double stageProgress,
    @JsonProperty("overallProgress") double overallProgress,
    @JsonProperty("version")         long version,
    @JsonProperty("active")          boolean active
) {
    public CropRecord {
        if (accumulatedGdd < 0) {
            throw new IllegalArgumentException("accumulatedGdd must be non-negative: " + accumulatedGdd);
        }
    }

    public static CropRecord sown(long cropId, long farmerId, CropKind kind, String variety,
                                  LocalDate sowingDate, String initialStage) {
        return new CropRecord(cropId, farmerId, kind, variety, sowingDate,
                              0.0, null, initialStage, 0.0, 0.0, 1L, true);
    }

    /** A record is usable for GDD tracking only once its sowing date is known. */
    @JsonIgnore
    public boolean isComplete() {
        return cropKind != null && sowingDate != null;
    }

    /** First calendar day whose temperature has not yet been folded into {@code accumulatedGdd}. */
    @JsonIgnore
    public LocalDate nextGddDay() {
        return gddCheckpoint == null ? sowingDate : gddCheckpoint.plusDays(1);
    }

    public int daysSinceSowing(LocalDate asOf) {
        if (sowingDate == null) return 0;
        return (int) Math.max(0, ChronoUnit.DAYS.between(sowingDate, asOf));
    }

    /** Applies a committed delta. Only the context store calls this. */
    public CropRecord apply(CropDelta delta) {
        return new CropRecord(cropId, farmerId, cropKind, variety, sowingDate,
                              delta.accumulatedGdd(), delta.gddCheckpoint(), delta.stage(),
                              delta.stageProgress(), delta.overallProgress(), version + 1, active);
    }

    public CropRecord superseded() {
        return new CropRecord(cropId, farmerId, cropKind, variety, sowingDate, accumulatedGdd,
                              gddCheckpoint, stage, stageProgress, overallProgress, version + 1, false);
    }
}
