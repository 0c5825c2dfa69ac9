package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ThreatKind {
    PEST("pest"),
    DISEASE("disease"),
    HEAT_STRESS("heat-stress"),
    WATER_STRESS("water-stress"),
    SPRAY_UNSAFE("spray-unsafe");

    private final String label;

    ThreatKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
