package com.cropadvisor.orchestrator;

import com.cropadvisor.common.model.CropKind;
import com.cropadvisor.common.model.CropRegistration;
import com.cropadvisor.common.model.DailyForecast;
import com.cropadvisor.common.model.DailyTemperature;
import com.cropadvisor.common.model.FarmProfile;
import com.cropadvisor.common.model.GeoLocation;
import com.cropadvisor.common.model.IrrigationType;
import com.cropadvisor.common.model.WeatherCondition;
import com.cropadvisor.common.model.WeatherSnapshot;
import com.cropadvisor.common.phenology.CropKnowledgeBase;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/** Shared farm, crop and weather data for orchestrator tests. */
public final class OrchestratorFixtures {

    public static final long FARMER = 7L;
    public static final GeoLocation GUNTUR = new GeoLocation(16.3, 80.45, "Guntur");
    public static final Instant NOW = Instant.parse("2024-07-10T06:00:00Z");
    public static final LocalDate TODAY = LocalDate.of(2024, 7, 10);
    /** 30 days before {@link #TODAY}. */
    public static final LocalDate SOWN = LocalDate.of(2024, 6, 10);

    private OrchestratorFixtures() {}

    public static Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public static CropKnowledgeBase knowledgeBase() {
        return CropKnowledgeBase.fromClasspath(objectMapper(), CropKnowledgeBase.DEFAULT_RESOURCE);
    }

    public static FarmProfile rainfedProfile() {
        return new FarmProfile(FARMER, 2.5, IrrigationType.RAINFED, GUNTUR, "en");
    }

    public static FarmProfile profileWithoutLocation() {
        return new FarmProfile(FARMER, 2.5, IrrigationType.DRIP, null, "en");
    }

    public static CropRegistration riceSownThirtyDaysAgo() {
        return new CropRegistration(CropKind.RICE, "BPT-5204", SOWN, "germination");
    }

    /** 34/24 °C every day: 19 GDD per day over a 10 °C base. */
    public static List<DailyTemperature> warmDays(LocalDate from, LocalDate to) {
        List<DailyTemperature> days = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            days.add(new DailyTemperature(d, 34.0, 24.0));
        }
        return days;
    }

    /** Dry, calm, moderately warm week: irrigation needed, spraying safe, no heat stress. */
    public static WeatherSnapshot dryWeek(Instant fetchedAt) {
        List<DailyForecast> forecast = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            forecast.add(new DailyForecast(TODAY.plusDays(i), 33.0, 24.0, 0.0, 5.0, 10.0, WeatherCondition.CLEAR));
        }
        return new WeatherSnapshot(fetchedAt, GUNTUR, 31.0, 40.0, 0.0, 8.0, WeatherCondition.CLEAR, forecast);
    }

    /** Rain expected today. */
    public static WeatherSnapshot rainyDay(Instant fetchedAt) {
        List<DailyForecast> forecast = new ArrayList<>();
        forecast.add(new DailyForecast(TODAY, 30.0, 23.0, 18.0, 85.0, 14.0, WeatherCondition.RAINY));
        for (int i = 1; i < 7; i++) {
            forecast.add(new DailyForecast(TODAY.plusDays(i), 31.0, 23.0, 0.0, 20.0, 10.0, WeatherCondition.CLOUDY));
        }
        return new WeatherSnapshot(fetchedAt, GUNTUR, 27.0, 85.0, 0.0, 12.0, WeatherCondition.CLOUDY, forecast);
    }
}
