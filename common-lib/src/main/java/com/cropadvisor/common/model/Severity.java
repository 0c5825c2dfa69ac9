package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Declared low to high; {@link #ordinal()} is the display rank. */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
