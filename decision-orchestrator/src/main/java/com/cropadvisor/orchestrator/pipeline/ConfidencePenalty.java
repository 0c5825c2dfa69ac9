package com.cropadvisor.orchestrator.pipeline;

/**
 * Deductions from the intent's confidence ceiling, one per missing or degraded input.
 */
public enum ConfidencePenalty {
    WEATHER_UNAVAILABLE(0.20, "weather unavailable"),
    WEATHER_STALE(0.10, "weather stale"),
    CROP_RECORD_INCOMPLETE(0.15, "crop record incomplete"),
    CROP_STAGE_UNAVAILABLE(0.20, "crop stage unavailable"),
    TEMPERATURE_HISTORY_UNAVAILABLE(0.10, "temperature history unavailable"),
    GENERIC_PHENOLOGY(0.10, "generic phenology fallback"),
    RISK_UNAVAILABLE(0.10, "risk unavailable");

    private final double defaultAmount;
    private final String label;

    ConfidencePenalty(double defaultAmount, String label) {
        this.defaultAmount = defaultAmount;
        this.label = label;
    }

    public double defaultAmount() {
        return defaultAmount;
    }

    public String label() {
        return label;
    }
}
