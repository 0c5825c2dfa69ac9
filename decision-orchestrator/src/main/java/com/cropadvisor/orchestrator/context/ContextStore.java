package com.cropadvisor.orchestrator.context;

import com.cropadvisor.common.model.CropDelta;
import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.CropRegistration;
import com.cropadvisor.common.model.FarmProfile;
import com.cropadvisor.common.model.WeatherSnapshot;
import reactor.core.publisher.Mono;

/**
 * Access to the farmer's stored context. Reads complete empty when nothing is stored.
 *
 * <p>{@link #commitCropDelta} is a compare-and-swap on the crop record's version: it errors
 * with {@code CommitConflictException} when the stored version differs from
 * {@code expectedVersion}, and bumps the version on success.
 */
public interface ContextStore {

    Mono<FarmProfile> getFarmProfile(long farmerId);

    Mono<CropRecord> getActiveCrop(long farmerId);

    Mono<CropRecord> commitCropDelta(long farmerId, CropDelta delta, long expectedVersion);

    Mono<FarmProfile> saveFarmProfile(FarmProfile profile);

    /** Registers a new active crop; the previous one is marked inactive, never deleted. */
    Mono<CropRecord> registerCrop(long farmerId, CropRegistration registration);

    Mono<Void> cacheWeather(long farmerId, WeatherSnapshot snapshot);

    Mono<WeatherSnapshot> lastWeather(long farmerId);
}
