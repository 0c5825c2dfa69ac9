package com.cropadvisor.orchestrator.controller;

import com.cropadvisor.common.exception.UnknownCropKindException;
import com.cropadvisor.common.model.CropKind;
import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.CropRegistration;
import com.cropadvisor.common.model.FarmProfile;
import com.cropadvisor.common.model.GeoLocation;
import com.cropadvisor.common.model.IrrigationType;
import com.cropadvisor.common.model.WeatherSnapshot;
import com.cropadvisor.common.phenology.CropKnowledgeBase;
import com.cropadvisor.orchestrator.context.ContextStore;
import com.cropadvisor.orchestrator.controller.dto.CropRegistrationRequest;
import com.cropadvisor.orchestrator.controller.dto.FarmProfileRequest;
import com.cropadvisor.orchestrator.controller.dto.FarmerContextResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * Seeding endpoints for the onboarding collaborator: farm profile, crop registration and
 * a read-back of the stored context.
 */
@RestController
@RequestMapping("/api/v1/context/farmers/{farmerId}")
public class ContextController {

    private final ContextStore contextStore;
    private final CropKnowledgeBase knowledgeBase;

    public ContextController(ContextStore contextStore, CropKnowledgeBase knowledgeBase) {
        this.contextStore = contextStore;
        this.knowledgeBase = knowledgeBase;
    }

    @PutMapping("/profile")
    public Mono<ResponseEntity<FarmProfile>> saveProfile(@PathVariable long farmerId,
                                                         @Valid @RequestBody FarmProfileRequest request) {
        GeoLocation location = request.getLatitude() != null && request.getLongitude() != null
            ? new GeoLocation(request.getLatitude(), request.getLongitude(), request.getLocationName())
            : null;
        FarmProfile profile = new FarmProfile(farmerId, request.getLandSizeAcres(),
            IrrigationType.fromKey(request.getIrrigationType()), location, request.getLanguage());
        return contextStore.saveFarmProfile(profile).map(ResponseEntity::ok);
    }

    @PostMapping("/crops")
    public Mono<ResponseEntity<CropRecord>> registerCrop(@PathVariable long farmerId,
                                                         @Valid @RequestBody CropRegistrationRequest request) {
        CropKind kind = CropKind.fromKey(request.getCropType());
        CropRegistration registration = new CropRegistration(kind, request.getVariety(),
            request.getSowingDate(), initialStage(kind));
        return contextStore.registerCrop(farmerId, registration)
            .map(crop -> ResponseEntity.status(HttpStatus.CREATED).body(crop));
    }

    @GetMapping
    public Mono<ResponseEntity<FarmerContextResponse>> get(@PathVariable long farmerId) {
        return Mono.zip(
                contextStore.getFarmProfile(farmerId).map(Optional::of).defaultIfEmpty(Optional.empty()),
                contextStore.getActiveCrop(farmerId).map(Optional::of).defaultIfEmpty(Optional.empty()),
                contextStore.lastWeather(farmerId).map(Optional::of).defaultIfEmpty(Optional.<WeatherSnapshot>empty()))
            .map(t -> t.getT1().isEmpty()
                ? ResponseEntity.notFound().<FarmerContextResponse>build()
                : ResponseEntity.ok(new FarmerContextResponse(t.getT1().get(),
                                                              t.getT2().orElse(null), t.getT3().orElse(null))));
    }

    @ExceptionHandler(UnknownCropKindException.class)
    public ResponseEntity<Map<String, String>> unknownCrop(UnknownCropKindException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "unsupported crop: " + e.getCropKey()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> invalid(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private String initialStage(CropKind kind) {
        try {
            return knowledgeBase.phenology(kind).initialStage();
        } catch (UnknownCropKindException e) {
            return knowledgeBase.generic().initialStage();
        }
    }
}
