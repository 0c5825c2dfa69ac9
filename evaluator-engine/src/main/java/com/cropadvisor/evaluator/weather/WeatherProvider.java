package com.cropadvisor.evaluator.weather;

import com.cropadvisor.common.model.GeoLocation;
import com.cropadvisor.common.model.WeatherSnapshot;
import reactor.core.publisher.Mono;

/**
 * Source of current conditions and short-range forecast. Errors with
 * {@code DataUnavailableException} when the provider cannot answer.
 */
public interface WeatherProvider {

    Mono<WeatherSnapshot> fetch(GeoLocation location);
}
