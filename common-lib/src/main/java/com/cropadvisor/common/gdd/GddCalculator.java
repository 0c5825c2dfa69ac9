package com.cropadvisor.common.gdd;

import com.cropadvisor.common.model.DailyTemperature;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Growing-degree-day arithmetic.
 *
 * <p>{@code GDD_day = max(0, (Tmax + Tmin) / 2 - Tbase)}. No upper temperature cap is
 * applied. Accumulation is idempotent per calendar day: a day at or before the
 * checkpoint, or a second reading for a day already counted, contributes nothing.
 *
 * <p>No I/O, no clock reads.
 */
public final class GddCalculator {

    private GddCalculator() { /* utility class */ }

    public static double dailyGdd(double tMax, double tMin, double baseTemperature) {
        return Math.max(0.0, (tMax + tMin) / 2.0 - baseTemperature);
    }

    public static double dailyGdd(DailyTemperature day, double baseTemperature) {
        return dailyGdd(day.tMax(), day.tMin(), baseTemperature);
    }

    /**
     * Folds {@code days} into {@code currentGdd}.
     *
     * @param currentGdd      stored total; must be non-negative
     * @param checkpoint      last day already counted, or {@code null} if none yet
     * @param days            daily readings in any order; duplicates keep the first reading
     * @param baseTemperature crop base temperature in °C
     */
    public static GddAccumulation accumulate(double currentGdd, LocalDate checkpoint,
                                             List<DailyTemperature> days, double baseTemperature) {
        if (currentGdd < 0) {
            throw new IllegalArgumentException("currentGdd must be non-negative: " + currentGdd);
        }
        TreeMap<LocalDate, DailyTemperature> byDay = new TreeMap<>();
        for (DailyTemperature day : days) {
            if (day == null || day.date() == null) continue;
            if (checkpoint != null && !day.date().isAfter(checkpoint)) continue;
            byDay.putIfAbsent(day.date(), day);
        }

        double added = 0.0;
        for (DailyTemperature day : byDay.values()) {
            added += dailyGdd(day, baseTemperature);
        }
        LocalDate newCheckpoint = byDay.isEmpty() ? checkpoint : byDay.lastKey();
        double total = Math.max(currentGdd, round2(currentGdd + added));
        return new GddAccumulation(total, newCheckpoint, byDay.size(), round2(added));
    }

    public static double averageDailyGdd(double accumulatedGdd, int days) {
        return days <= 0 ? 0.0 : accumulatedGdd / days;
    }

    /**
     * Days needed to reach {@code targetGdd} at {@code averageDailyGdd} per day.
     * Empty when the average is not positive; zero when the target is already reached.
     */
    public static OptionalInt daysToTarget(double currentGdd, double targetGdd, double averageDailyGdd) {
        if (currentGdd >= targetGdd) return OptionalInt.of(0);
        if (averageDailyGdd <= 0) return OptionalInt.empty();
        return OptionalInt.of((int) Math.ceil((targetGdd - currentGdd) / averageDailyGdd));
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
