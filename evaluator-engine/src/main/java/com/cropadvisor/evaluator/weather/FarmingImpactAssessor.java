package com.cropadvisor.evaluator.weather;

import com.cropadvisor.common.model.DailyForecast;
import com.cropadvisor.common.model.FarmingImpact;
import com.cropadvisor.common.model.WeatherCondition;
import com.cropadvisor.common.model.WeatherSnapshot;

import java.util.List;
import java.util.Locale;

/**
 * Pure translation of a {@link WeatherSnapshot} into {@link FarmingImpact}.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>rain risk: today's precipitation probability rounded to a whole percent, raised to
 *       at least 0.9 while it is raining</li>
 *   <li>heat stress: hottest forecast maximum over the lookahead window, stepped 0.9 / 0.6 / 0.3</li>
 *   <li>spray safe: calm wind and low rain risk</li>
 *   <li>irrigation needed: no wet day in the lookahead window and dry air</li>
 *   <li>field work safe: not raining, no storm, wind below the field-work limit</li>
 * </ul>
 */
public final class FarmingImpactAssessor {

    private static final double RAINING_NOW_RISK = 0.9;

    private final WeatherThresholds thresholds;

    public FarmingImpactAssessor(WeatherThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public FarmingImpact assess(WeatherSnapshot weather) {
        List<DailyForecast> forecast = weather.forecast();

        double rainRisk = forecast.isEmpty() ? 0.0 : Math.round(forecast.get(0).precipitationProbability()) / 100.0;
        if (weather.precipitation() > 0) {
            rainRisk = Math.max(rainRisk, RAINING_NOW_RISK);
        }
        rainRisk = Math.min(1.0, Math.max(0.0, rainRisk));

        double hottest = forecast.stream()
            .limit(thresholds.heatLookaheadDays())
            .mapToDouble(DailyForecast::tMax)
            .max()
            .orElse(weather.temperature());
        double heatStressRisk = heatStress(hottest);

        boolean spraySafe = weather.windSpeed() < thresholds.sprayMaxWindKmh()
                            && rainRisk < thresholds.sprayMaxRainRisk();

        boolean wetDayAhead = forecast.stream()
            .limit(thresholds.irrigationLookaheadDays())
            .anyMatch(d -> d.precipitationSum() >= thresholds.irrigationRainMm()
                        || d.precipitationProbability() >= thresholds.irrigationRainProbability());
        boolean irrigationNeeded = !wetDayAhead && weather.humidity() < thresholds.irrigationMaxHumidity();

        boolean fieldWorkSafe = weather.precipitation() < thresholds.fieldWorkMaxPrecipitationMm()
                                && weather.condition() != WeatherCondition.STORMY
                                && weather.windSpeed() < thresholds.fieldWorkMaxWindKmh();

        String reasoning = String.format(Locale.ROOT,
            "rainRisk=%.2f heatStressRisk=%.2f (max tMax %.1f°C) spraySafe=%s irrigationNeeded=%s fieldWorkSafe=%s",
            rainRisk, heatStressRisk, hottest, spraySafe, irrigationNeeded, fieldWorkSafe);

        return new FarmingImpact(rainRisk, heatStressRisk, spraySafe, irrigationNeeded, fieldWorkSafe, reasoning);
    }

    private double heatStress(double maxTemperature) {
        if (maxTemperature > thresholds.heatHighCelsius())   return 0.9;
        if (maxTemperature > thresholds.heatMediumCelsius()) return 0.6;
        if (maxTemperature > thresholds.heatLowCelsius())    return 0.3;
        return 0.0;
    }
}
