package com.cropadvisor.evaluator.weather;

import com.cropadvisor.common.model.DailyForecast;
import com.cropadvisor.common.model.GeoLocation;
import com.cropadvisor.common.model.WeatherCondition;
import com.cropadvisor.common.model.WeatherSnapshot;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Builders for weather snapshots used across evaluator tests. */
public final class WeatherFixtures {

    public static final GeoLocation GUNTUR = new GeoLocation(16.3, 80.45, "Guntur");
    public static final Instant FETCHED_AT = Instant.parse("2024-07-10T05:00:00Z");
    public static final LocalDate TODAY = LocalDate.of(2024, 7, 10);

    private WeatherFixtures() {}

    public static DailyForecast day(int offset, double tMax, double rainMm, double rainProbability) {
        return new DailyForecast(TODAY.plusDays(offset), tMax, tMax - 10, rainMm, rainProbability, 12.0,
                                 rainMm > 0 ? WeatherCondition.RAINY : WeatherCondition.CLEAR);
    }

    public static WeatherSnapshot snapshot(double humidity, double precipitationNow, double wind,
                                           WeatherCondition condition, List<DailyForecast> forecast) {
        return new WeatherSnapshot(FETCHED_AT, GUNTUR, 31.0, humidity, precipitationNow, wind, condition, forecast);
    }

    /** Dry, hot, calm week. */
    public static WeatherSnapshot dryWeek(double maxTemperature) {
        List<DailyForecast> days = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            days.add(day(i, maxTemperature, 0.0, 5.0));
        }
        return snapshot(40.0, 0.0, 8.0, WeatherCondition.CLEAR, days);
    }

    /** Rain expected today with the given probability. */
    public static WeatherSnapshot rainToday(double probability, double millimetres) {
        List<DailyForecast> days = new ArrayList<>();
        days.add(day(0, 30.0, millimetres, probability));
        for (int i = 1; i < 7; i++) {
            days.add(day(i, 30.0, 0.0, 10.0));
        }
        return snapshot(75.0, 0.0, 10.0, WeatherCondition.CLOUDY, days);
    }
}
