package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecommendedAction {
    IRRIGATE,
    DO_NOT_IRRIGATE,
    IRRIGATE_IF_DRY,
    MONITOR,
    PROTECT_FROM_HEAT,
    FIELD_WORK_OK,
    AVOID_FIELD_WORK,
    PREPARE_HARVEST,
    HARVEST_NOT_READY,
    REGISTER_CROP,
    COMPLETE_PROFILE,
    INFORM,
    INSUFFICIENT_DATA,
    UNSUPPORTED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
