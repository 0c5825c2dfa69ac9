package com.cropadvisor.common.gdd;

import java.time.LocalDate;

/**
 * Result of folding a run of daily temperatures into a crop's GDD total.
 *
 * @param accumulatedGdd new total, rounded to two decimals, never below the previous total
 * @param checkpoint     last day folded in; unchanged when no new day was counted
 * @param daysCounted    number of new calendar days that contributed
 * @param addedGdd       GDD added by those days
 */
public record GddAccumulation(double accumulatedGdd, LocalDate checkpoint, int daysCounted, double addedGdd) {

    public boolean advanced() {
        return daysCounted > 0;
    }
}
