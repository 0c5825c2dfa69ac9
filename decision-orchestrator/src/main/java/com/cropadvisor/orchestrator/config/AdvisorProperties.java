package com.cropadvisor.orchestrator.config;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.evaluator.weather.WeatherThresholds;
import com.cropadvisor.orchestrator.pipeline.ConfidencePenalty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the advisory engine, bound from {@code advisor.*}.
 */
@Data
@ConfigurationProperties(prefix = "advisor")
public class AdvisorProperties {

    private Weather weather = new Weather();
    private Deadlines deadlines = new Deadlines();
    private Confidence confidence = new Confidence();

    /**
     * Optional precedence overrides keyed by class name (IRRIGATION, STATUS, CONTEXT).
     * Classes not listed keep the built-in order.
     */
    private Map<String, List<EvaluatorId>> precedence = new LinkedHashMap<>();

    @Data
    public static class Weather {
        private double sprayMaxWindKmh = 15.0;
        private double sprayMaxRainRisk = 0.3;
        private int irrigationLookaheadDays = 3;
        private double irrigationRainMm = 5.0;
        private double irrigationRainProbability = 50.0;
        private double irrigationMaxHumidity = 60.0;
        private double fieldWorkMaxPrecipitationMm = 1.0;
        private double fieldWorkMaxWindKmh = 30.0;
        private int heatLookaheadDays = 3;
        private double heatHighCelsius = 38.0;
        private double heatMediumCelsius = 35.0;
        private double heatLowCelsius = 32.0;
        /** Oldest cached snapshot still usable when live weather is down. */
        private Duration staleness = Duration.ofHours(6);

        public WeatherThresholds toThresholds() {
            return new WeatherThresholds(sprayMaxWindKmh, sprayMaxRainRisk, irrigationLookaheadDays,
                irrigationRainMm, irrigationRainProbability, irrigationMaxHumidity,
                fieldWorkMaxPrecipitationMm, fieldWorkMaxWindKmh, heatLookaheadDays,
                heatHighCelsius, heatMediumCelsius, heatLowCelsius);
        }
    }

    @Data
    public static class Deadlines {
        private Duration weather = Duration.ofSeconds(4);
        private Duration cropStage = Duration.ofSeconds(3);
        private Duration risk = Duration.ofSeconds(3);
        private Duration context = Duration.ofSeconds(3);

        public Duration forEvaluator(EvaluatorId id) {
            switch (id) {
                case WEATHER:    return weather;
                case CROP_STAGE: return cropStage;
                case RISK:       return risk;
                default:         return context;
            }
        }
    }

    @Data
    public static class Confidence {
        private double floor = 0.1;
        private Map<ConfidencePenalty, Double> penalties = new EnumMap<>(ConfidencePenalty.class);

        /** Configured amount, or the penalty's built-in default. */
        public double amountOf(ConfidencePenalty penalty) {
            Double configured = penalties.get(penalty);
            return configured != null ? configured : penalty.defaultAmount();
        }
    }
}
