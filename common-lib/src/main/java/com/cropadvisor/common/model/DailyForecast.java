package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record DailyForecast(
    @JsonProperty("date")                     LocalDate date,
    @JsonProperty("tMax")                     double tMax,
    @JsonProperty("tMin")                     double tMin,
    @JsonProperty("precipitationSum")         double precipitationSum,
    @JsonProperty("precipitationProbability") double precipitationProbability,
    @JsonProperty("windSpeedMax")             double windSpeedMax,
    @JsonProperty("condition")                WeatherCondition condition
) {}
