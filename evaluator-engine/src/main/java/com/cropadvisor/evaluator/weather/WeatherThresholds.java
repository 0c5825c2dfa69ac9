package com.cropadvisor.evaluator.weather;

/**
 * Thresholds that translate weather into farming impact. Wind in km/h, rain in mm,
 * probabilities and humidity in percent, temperatures in °C.
 */
public record WeatherThresholds(
    double sprayMaxWindKmh,
    double sprayMaxRainRisk,
    int irrigationLookaheadDays,
    double irrigationRainMm,
    double irrigationRainProbability,
    double irrigationMaxHumidity,
    double fieldWorkMaxPrecipitationMm,
    double fieldWorkMaxWindKmh,
    int heatLookaheadDays,
    double heatHighCelsius,
    double heatMediumCelsius,
    double heatLowCelsius
) {
    public static WeatherThresholds defaults() {
        return new WeatherThresholds(15.0, 0.3, 3, 5.0, 50.0, 60.0, 1.0, 30.0, 3, 38.0, 35.0, 32.0);
    }
}
