package com.cropadvisor.common.model;

import java.time.LocalDate;

public record DailyTemperature(LocalDate date, double tMax, double tMin) {

    public double mean() {
        return (tMax + tMin) / 2.0;
    }

    /** Convenience for series where only the daily mean is known. */
    public static DailyTemperature ofMean(LocalDate date, double mean) {
        return new DailyTemperature(date, mean, mean);
    }
}
