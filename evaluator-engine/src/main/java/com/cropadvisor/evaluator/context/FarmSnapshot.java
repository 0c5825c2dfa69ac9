package com.cropadvisor.evaluator.context;

import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.FarmProfile;
import com.cropadvisor.common.model.Intent;

import java.time.LocalDate;
import java.util.Map;

/**
 * Consistent read of a farmer's stored state taken once at the start of a run.
 * {@code activeCrop} is {@code null} when no crop is registered.
 */
public record FarmSnapshot(
    long farmerId,
    FarmProfile profile,
    CropRecord activeCrop,
    Intent intent,
    Map<String, String> entities,
    LocalDate asOf
) {
    public FarmSnapshot {
        entities = entities == null ? Map.of() : Map.copyOf(entities);
    }

    public boolean hasActiveCrop() {
        return activeCrop != null;
    }
}
