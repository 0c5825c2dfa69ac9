package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Relative water requirement of a growth stage, as recorded in the crop knowledge base.
 */
public enum WaterNeed {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WaterNeed fromKey(String raw) {
        return raw == null ? MEDIUM : WaterNeed.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public boolean atLeast(WaterNeed other) {
        return ordinal() >= other.ordinal();
    }
}
