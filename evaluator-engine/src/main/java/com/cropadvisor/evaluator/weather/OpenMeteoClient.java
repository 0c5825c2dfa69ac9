package com.cropadvisor.evaluator.weather;

import com.cropadvisor.common.exception.DataUnavailableException;
import com.cropadvisor.common.model.DailyForecast;
import com.cropadvisor.common.model.DailyTemperature;
import com.cropadvisor.common.model.GeoLocation;
import com.cropadvisor.common.model.WeatherCondition;
import com.cropadvisor.common.model.WeatherSnapshot;
import com.cropadvisor.evaluator.cropstage.TemperatureHistorySource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Open-Meteo client (no API key). Serves live forecasts and the daily temperature history
 * used for GDD accumulation. Ranges starting more than {@code archiveAfterDays} in the past
 * go to the archive API, which the forecast API cannot serve.
 *
 * <p>Every failure (transport, non-2xx status, malformed body) surfaces as
 * {@link DataUnavailableException}.
 */
public class OpenMeteoClient implements WeatherProvider, TemperatureHistorySource {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoClient.class);
    private static final String COMPONENT = "OpenMeteo";

    static final String CURRENT_FIELDS =
        "temperature_2m,relative_humidity_2m,precipitation,weather_code,cloud_cover,wind_speed_10m";
    static final String DAILY_FIELDS =
        "weather_code,temperature_2m_max,temperature_2m_min,precipitation_sum,"
        + "precipitation_probability_max,wind_speed_10m_max";
    static final String HISTORY_FIELDS = "temperature_2m_max,temperature_2m_min";

    private final WebClient forecastClient;
    private final WebClient archiveClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int forecastDays;
    private final int archiveAfterDays;

    public OpenMeteoClient(WebClient forecastClient, WebClient archiveClient, ObjectMapper objectMapper,
                           Clock clock, int forecastDays, int archiveAfterDays) {
        this.forecastClient   = forecastClient;
        this.archiveClient    = archiveClient;
        this.objectMapper     = objectMapper;
        this.clock            = clock;
        this.forecastDays     = forecastDays;
        this.archiveAfterDays = archiveAfterDays;
    }

    @Override
    public Mono<WeatherSnapshot> fetch(GeoLocation location) {
        log.info("Fetching forecast. provider=OpenMeteo lat={} lon={}", location.latitude(), location.longitude());
        return forecastClient.get()
            .uri(uri -> uri.path("/v1/forecast")
                .queryParam("latitude", location.latitude())
                .queryParam("longitude", location.longitude())
                .queryParam("current", CURRENT_FIELDS)
                .queryParam("daily", DAILY_FIELDS)
                .queryParam("timezone", "auto")
                .queryParam("forecast_days", forecastDays)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parseForecast(json, location, clock.instant()))
            .onErrorMap(e -> !(e instanceof DataUnavailableException),
                        e -> new DataUnavailableException(COMPONENT, "forecast request failed: " + e.getMessage(), e))
            .doOnError(e -> log.warn("Forecast fetch failed. lat={} lon={} reason={}",
                                     location.latitude(), location.longitude(), e.getMessage()));
    }

    @Override
    public Mono<List<DailyTemperature>> dailyTemperatures(GeoLocation location, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            return Mono.just(List.of());
        }
        boolean archive = from.isBefore(LocalDate.now(clock).minusDays(archiveAfterDays));
        WebClient client = archive ? archiveClient : forecastClient;
        String path = archive ? "/v1/archive" : "/v1/forecast";
        log.info("Fetching temperature history. provider=OpenMeteo api={} from={} to={}",
                 archive ? "archive" : "forecast", from, to);

        return client.get()
            .uri(uri -> uri.path(path)
                .queryParam("latitude", location.latitude())
                .queryParam("longitude", location.longitude())
                .queryParam("daily", HISTORY_FIELDS)
                .queryParam("start_date", from.toString())
                .queryParam("end_date", to.toString())
                .queryParam("timezone", "auto")
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(this::parseDailyTemperatures)
            .onErrorMap(e -> !(e instanceof DataUnavailableException),
                        e -> new DataUnavailableException(COMPONENT, "history request failed: " + e.getMessage(), e));
    }

    WeatherSnapshot parseForecast(String json, GeoLocation location, Instant fetchedAt) {
        JsonNode root = readTree(json);
        JsonNode current = root.path("current");
        if (!current.isObject() || !current.path("temperature_2m").isNumber()) {
            throw new DataUnavailableException(COMPONENT, "malformed forecast body: missing current conditions");
        }

        JsonNode daily = root.path("daily");
        JsonNode dates = daily.path("time");
        List<DailyForecast> forecast = new ArrayList<>();
        for (int i = 0; i < dates.size(); i++) {
            JsonNode tMax = daily.path("temperature_2m_max").path(i);
            JsonNode tMin = daily.path("temperature_2m_min").path(i);
            if (!tMax.isNumber() || !tMin.isNumber()) continue;
            forecast.add(new DailyForecast(
                parseDate(dates.get(i).asText()),
                tMax.asDouble(),
                tMin.asDouble(),
                daily.path("precipitation_sum").path(i).asDouble(0.0),
                daily.path("precipitation_probability_max").path(i).asDouble(0.0),
                daily.path("wind_speed_10m_max").path(i).asDouble(0.0),
                WeatherCondition.fromWmoCode(daily.path("weather_code").path(i).asInt(3))));
        }

        return new WeatherSnapshot(
            fetchedAt,
            location,
            current.path("temperature_2m").asDouble(),
            current.path("relative_humidity_2m").asDouble(0.0),
            current.path("precipitation").asDouble(0.0),
            current.path("wind_speed_10m").asDouble(0.0),
            WeatherCondition.fromWmoCode(current.path("weather_code").asInt(3)),
            forecast);
    }

    List<DailyTemperature> parseDailyTemperatures(String json) {
        JsonNode daily = readTree(json).path("daily");
        JsonNode dates = daily.path("time");
        if (!dates.isArray()) {
            throw new DataUnavailableException(COMPONENT, "malformed history body: missing daily.time");
        }
        List<DailyTemperature> days = new ArrayList<>();
        for (int i = 0; i < dates.size(); i++) {
            JsonNode tMax = daily.path("temperature_2m_max").path(i);
            JsonNode tMin = daily.path("temperature_2m_min").path(i);
            // the archive lags a few days behind; those days come back as nulls
            if (!tMax.isNumber() || !tMin.isNumber()) continue;
            days.add(new DailyTemperature(parseDate(dates.get(i).asText()), tMax.asDouble(), tMin.asDouble()));
        }
        return days;
    }

    private JsonNode readTree(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new DataUnavailableException(COMPONENT, "malformed body: not a JSON object");
            }
            if (root.path("error").asBoolean(false)) {
                throw new DataUnavailableException(COMPONENT, "provider error: " + root.path("reason").asText());
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new DataUnavailableException(COMPONENT, "malformed body: " + e.getOriginalMessage(), e);
        }
    }

    private static LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new DataUnavailableException(COMPONENT, "malformed date '" + raw + "'", e);
        }
    }
}
