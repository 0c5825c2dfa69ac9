package com.cropadvisor.common.phenology;

import com.cropadvisor.common.exception.UnknownCropKindException;
import com.cropadvisor.common.model.CropKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Static reference data: base temperature and stage table per crop, plus a generic curve
 * used when a crop has no entry. Loaded once from JSON and immutable afterwards.
 */
public final class CropKnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(CropKnowledgeBase.class);

    public static final String DEFAULT_RESOURCE = "crop-knowledge-base.json";

    private final Map<CropKind, CropPhenology> crops;
    private final CropPhenology generic;

    public CropKnowledgeBase(Map<CropKind, CropPhenology> crops, CropPhenology generic) {
        if (generic == null) {
            throw new IllegalArgumentException("generic phenology curve is required");
        }
        EnumMap<CropKind, CropPhenology> copy = new EnumMap<>(CropKind.class);
        copy.putAll(crops);
        this.crops = Collections.unmodifiableMap(copy);
        this.generic = generic;
    }

    /**
     * Loads the knowledge base from a classpath resource.
     *
     * @throws IllegalStateException when the resource is missing or fails validation
     */
    public static CropKnowledgeBase fromClasspath(ObjectMapper mapper, String resource) {
        ClassLoader loader = CropKnowledgeBase.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("crop knowledge base not found on classpath: " + resource);
            }
            return read(mapper, in);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read crop knowledge base " + resource, e);
        }
    }

    static CropKnowledgeBase read(ObjectMapper mapper, InputStream in) throws IOException {
        Document document = mapper.readValue(in, Document.class);
        EnumMap<CropKind, CropPhenology> crops = new EnumMap<>(CropKind.class);
        if (document.crops() != null) {
            document.crops().forEach((key, phenology) -> {
                try {
                    crops.put(CropKind.fromKey(key), phenology);
                } catch (UnknownCropKindException e) {
                    log.warn("[CropKnowledgeBase] Skipping entry for unsupported crop key={}", key);
                }
            });
        }
        log.info("[CropKnowledgeBase] Loaded crops={} genericStages={}",
                 crops.keySet(), document.generic() == null ? 0 : document.generic().stages().size());
        return new CropKnowledgeBase(crops, document.generic());
    }

    /**
     * @throws UnknownCropKindException when the crop has no entry
     */
    public CropPhenology phenology(CropKind kind) {
        CropPhenology phenology = kind == null ? null : crops.get(kind);
        if (phenology == null) {
            throw new UnknownCropKindException(kind == null ? "null" : kind.key());
        }
        return phenology;
    }

    public CropPhenology generic() {
        return generic;
    }

    public Set<CropKind> supportedCrops() {
        return crops.keySet();
    }

    /** JSON document shape. */
    record Document(
        @JsonProperty("crops")   Map<String, CropPhenology> crops,
        @JsonProperty("generic") CropPhenology generic
    ) {}
}
