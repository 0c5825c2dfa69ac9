package com.cropadvisor.evaluator.weather;

import com.cropadvisor.common.model.FarmingImpact;
import com.cropadvisor.common.model.WeatherSnapshot;

/**
 * @param stale  built from a cached snapshot because live weather was unavailable
 * @param source data source tag reported in the decision
 */
public record WeatherReport(WeatherSnapshot snapshot, FarmingImpact impact, boolean stale,
                            String source, String justification) {

    public static final String LIVE_SOURCE = "open-meteo";
    public static final String CACHED_SOURCE = "open-meteo-cache";
}
