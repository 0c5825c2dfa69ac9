package com.cropadvisor.orchestrator.context;

import com.cropadvisor.common.exception.CommitConflictException;
import com.cropadvisor.common.model.CropDelta;
import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.CropRegistration;
import com.cropadvisor.common.model.FarmProfile;
import com.cropadvisor.common.model.WeatherSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ContextStore} backed by concurrent maps. Crop commits are atomic per farmer
 * through {@link ConcurrentHashMap#compute}.
 *
 * <p>Versions are monotonic per farmer across crop registrations, so a delta computed
 * against a superseded crop can never match the new crop's version.
 */
@Component
public class InMemoryContextStore implements ContextStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryContextStore.class);

    private final Map<Long, FarmProfile> profiles = new ConcurrentHashMap<>();
    private final Map<Long, CropRecord> activeCrops = new ConcurrentHashMap<>();
    private final Map<Long, List<CropRecord>> supersededCrops = new ConcurrentHashMap<>();
    private final Map<Long, WeatherSnapshot> weatherCache = new ConcurrentHashMap<>();
    private final AtomicLong cropIds = new AtomicLong();

    @Override
    public Mono<FarmProfile> getFarmProfile(long farmerId) {
        return Mono.justOrEmpty(profiles.get(farmerId));
    }

    @Override
    public Mono<CropRecord> getActiveCrop(long farmerId) {
        return Mono.justOrEmpty(activeCrops.get(farmerId));
    }

    @Override
    public Mono<CropRecord> commitCropDelta(long farmerId, CropDelta delta, long expectedVersion) {
        return Mono.fromCallable(() -> activeCrops.compute(farmerId, (id, current) -> {
            if (current == null) {
                throw new CommitConflictException(farmerId, expectedVersion, -1L);
            }
            if (current.version() != expectedVersion) {
                throw new CommitConflictException(farmerId, expectedVersion, current.version());
            }
            if (delta.accumulatedGdd() < current.accumulatedGdd()) {
                throw new IllegalArgumentException("GDD may not decrease: " + current.accumulatedGdd()
                                                   + " -> " + delta.accumulatedGdd());
            }
            return current.apply(delta);
        }))
        .doOnNext(saved -> log.info("Crop delta committed. farmerId={} cropId={} version={} gdd={} stage={}",
                                    farmerId, saved.cropId(), saved.version(), saved.accumulatedGdd(), saved.stage()));
    }

    @Override
    public Mono<FarmProfile> saveFarmProfile(FarmProfile profile) {
        return Mono.fromCallable(() -> {
            profiles.put(profile.farmerId(), profile);
            log.info("Farm profile saved. farmerId={} irrigation={} hasLocation={}",
                     profile.farmerId(), profile.irrigationType().key(), profile.hasLocation());
            return profile;
        });
    }

    @Override
    public Mono<CropRecord> registerCrop(long farmerId, CropRegistration registration) {
        return Mono.fromCallable(() -> activeCrops.compute(farmerId, (id, current) -> {
            long version = 1L;
            if (current != null) {
                supersededCrops.computeIfAbsent(farmerId, k -> new CopyOnWriteArrayList<>())
                    .add(current.superseded());
                version = current.version() + 2;
            }
            return new CropRecord(cropIds.incrementAndGet(), farmerId, registration.cropKind(),
                                  registration.variety(), registration.sowingDate(), 0.0, null,
                                  registration.initialStage(), 0.0, 0.0, version, true);
        }))
        .doOnNext(crop -> log.info("Crop registered. farmerId={} cropId={} crop={} sowingDate={}",
                                   farmerId, crop.cropId(), crop.cropKind().key(), crop.sowingDate()));
    }

    @Override
    public Mono<Void> cacheWeather(long farmerId, WeatherSnapshot snapshot) {
        return Mono.fromRunnable(() -> weatherCache.merge(farmerId, snapshot,
            (existing, incoming) -> incoming.fetchedAt().isAfter(existing.fetchedAt()) ? incoming : existing));
    }

    @Override
    public Mono<WeatherSnapshot> lastWeather(long farmerId) {
        return Mono.justOrEmpty(weatherCache.get(farmerId));
    }

    /** Crops that were replaced by a later registration, oldest first. */
    public List<CropRecord> cropHistory(long farmerId) {
        return new ArrayList<>(supersededCrops.getOrDefault(farmerId, List.of()));
    }
}
