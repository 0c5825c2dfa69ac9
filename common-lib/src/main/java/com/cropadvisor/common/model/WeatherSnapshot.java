package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Current conditions plus a short daily forecast for one location, as fetched from the
 * weather provider. Never the source of truth; the context store keeps only the latest
 * one per farmer for offline degradation.
 */
public record WeatherSnapshot(
    @JsonProperty("fetchedAt")     Instant fetchedAt,
    @JsonProperty("location")      GeoLocation location,
    @JsonProperty("temperature")   double temperature,
    @JsonProperty("humidity")      double humidity,
    @JsonProperty("precipitation") double precipitation,
    @JsonProperty("windSpeed")     double windSpeed,
    @JsonProperty("condition")     WeatherCondition condition,
    @JsonProperty("forecast")      List<DailyForecast> forecast
) {
    public WeatherSnapshot {
        forecast = forecast == null ? List.of() : List.copyOf(forecast);
    }

    public Duration ageAt(Instant now) {
        return Duration.between(fetchedAt, now);
    }
}
