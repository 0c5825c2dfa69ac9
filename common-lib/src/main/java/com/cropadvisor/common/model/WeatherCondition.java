package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Farming-relevant weather categories derived from WMO weather interpretation codes.
 */
public enum WeatherCondition {
    CLEAR,
    PARTLY_CLOUDY,
    CLOUDY,
    FOGGY,
    RAINY,
    STORMY;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WeatherCondition fromWmoCode(int code) {
        if (code == 0) return CLEAR;
        if (code == 1 || code == 2) return PARTLY_CLOUDY;
        if (code == 3) return CLOUDY;
        if (code == 45 || code == 48) return FOGGY;
        if (code >= 51 && code <= 67) return RAINY;
        if (code >= 71 && code <= 86) return RAINY;   // snow counts as wet for field work
        if (code >= 95) return STORMY;
        return CLOUDY;
    }
}
