package com.cropadvisor.evaluator.weather;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.FarmingImpact;
import com.cropadvisor.common.model.GeoLocation;
import com.cropadvisor.common.model.WeatherSnapshot;
import com.cropadvisor.evaluator.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Fetches live weather for a location and assesses its farming impact.
 * Has no side effects; caching the snapshot is the orchestrator's job.
 */
@Component
public class WeatherEvaluator implements Evaluator<GeoLocation, WeatherReport> {

    private static final Logger log = LoggerFactory.getLogger(WeatherEvaluator.class);

    private final WeatherProvider provider;
    private final FarmingImpactAssessor assessor;

    public WeatherEvaluator(WeatherProvider provider, FarmingImpactAssessor assessor) {
        this.provider = provider;
        this.assessor = assessor;
    }

    @Override
    public EvaluatorId id() {
        return EvaluatorId.WEATHER;
    }

    @Override
    public Mono<WeatherReport> evaluate(GeoLocation location) {
        log.info("[WeatherEvaluator] Fetching weather lat={} lon={}", location.latitude(), location.longitude());
        return provider.fetch(location).map(snapshot -> report(snapshot, false, WeatherReport.LIVE_SOURCE));
    }

    /** Builds a report from a snapshot already held by the caller, e.g. the last cached one. */
    public WeatherReport fromCached(WeatherSnapshot snapshot) {
        return report(snapshot, true, WeatherReport.CACHED_SOURCE);
    }

    private WeatherReport report(WeatherSnapshot snapshot, boolean stale, String source) {
        FarmingImpact impact = assessor.assess(snapshot);
        String justification = String.format(Locale.ROOT, "%s%.1f°C, humidity %.0f%%, wind %.1f km/h, %s; %s",
            stale ? "cached weather " : "", snapshot.temperature(), snapshot.humidity(),
            snapshot.windSpeed(), snapshot.condition().key(), impact.reasoning());
        return new WeatherReport(snapshot, impact, stale, source, justification);
    }
}
