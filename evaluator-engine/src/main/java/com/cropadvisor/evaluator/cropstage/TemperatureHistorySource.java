package com.cropadvisor.evaluator.cropstage;

import com.cropadvisor.common.model.DailyTemperature;
import com.cropadvisor.common.model.GeoLocation;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Daily maximum and minimum temperatures for a closed date range. Days the source has no
 * reading for are simply absent from the list.
 */
public interface TemperatureHistorySource {

    Mono<List<DailyTemperature>> dailyTemperatures(GeoLocation location, LocalDate from, LocalDate to);
}
