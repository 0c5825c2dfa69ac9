package com.cropadvisor.common.model;

import com.cropadvisor.common.exception.UnsupportedIntentException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of intents the NLU collaborator may emit. Wire names are snake_case.
 */
public enum Intent {
    IRRIGATION_QUERY("irrigation_query"),
    WEATHER_QUERY("weather_query"),
    CROP_STATUS_QUERY("crop_status_query"),
    HARVEST_TIMING_QUERY("harvest_timing_query"),
    GENERAL_QUERY("general_query"),
    CROP_ONBOARDING_INTENT("crop_onboarding_intent");

    private final String wireName;

    Intent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @throws UnsupportedIntentException for anything outside the closed set
     */
    public static Intent fromWire(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (Intent intent : values()) {
                if (intent.wireName.equals(normalized)) return intent;
            }
        }
        throw new UnsupportedIntentException(raw);
    }
}
