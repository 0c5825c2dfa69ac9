package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IrrigationType {
    RAINFED,
    DRIP,
    SPRINKLER,
    FLOOD,
    CANAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unrecognised or missing values default to {@link #RAINFED}, the most conservative assumption. */
    @JsonCreator
    public static IrrigationType fromKey(String raw) {
        if (raw == null) return RAINFED;
        for (IrrigationType type : values()) {
            if (type.key().equalsIgnoreCase(raw.trim())) return type;
        }
        return RAINFED;
    }
}
