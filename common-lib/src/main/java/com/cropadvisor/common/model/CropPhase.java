package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse phenological phase a named stage belongs to. Risk rules match on phase so a
 * single rule covers "heading" in wheat, "silking" in maize and "flowering" in cotton.
 */
public enum CropPhase {
    ESTABLISHMENT,
    VEGETATIVE,
    FLOWERING,
    MATURATION;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CropPhase fromKey(String raw) {
        return CropPhase.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
