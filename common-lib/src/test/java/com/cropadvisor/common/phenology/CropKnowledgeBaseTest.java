package com.cropadvisor.common.phenology;

import com.cropadvisor.common.exception.UnknownCropKindException;
import com.cropadvisor.common.model.CropKind;
import com.cropadvisor.common.model.CropPhase;
import com.cropadvisor.common.model.WaterNeed;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CropKnowledgeBaseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("bundled knowledge base loads under a Turkish default locale")
    void bundledResourceTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            CropKnowledgeBase kb = CropKnowledgeBase.fromClasspath(mapper, CropKnowledgeBase.DEFAULT_RESOURCE);
            assertEquals(WaterNeed.CRITICAL, kb.phenology(CropKind.RICE).position(600).stage().waterNeed());
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("bundled knowledge base covers every supported crop with the expected base temperatures")
    void bundledResource() {
        CropKnowledgeBase kb = CropKnowledgeBase.fromClasspath(mapper, CropKnowledgeBase.DEFAULT_RESOURCE);

        assertEquals(EnumSet.allOf(CropKind.class), kb.supportedCrops());
        assertEquals(10.0, kb.phenology(CropKind.RICE).baseTemperature(), 1e-9);
        assertEquals(4.5, kb.phenology(CropKind.WHEAT).baseTemperature(), 1e-9);
        assertEquals(15.5, kb.phenology(CropKind.COTTON).baseTemperature(), 1e-9);
        assertEquals(5.0, kb.phenology(CropKind.ONION).baseTemperature(), 1e-9);
        assertNotNull(kb.generic());
    }

    @Test
    @DisplayName("rice stage bounds and attributes are read from JSON")
    void riceStages() {
        CropKnowledgeBase kb = CropKnowledgeBase.fromClasspath(mapper, CropKnowledgeBase.DEFAULT_RESOURCE);
        CropPhenology rice = kb.phenology(CropKind.RICE);

        assertEquals("germination", rice.initialStage());
        StageBoundary flowering = rice.stage("flowering").orElseThrow();
        assertEquals(WaterNeed.CRITICAL, flowering.waterNeed());
        assertEquals(CropPhase.FLOWERING, flowering.phase());
        assertTrue(flowering.heatSensitive());
    }

    @Test
    @DisplayName("missing crop entry raises UnknownCropKindException")
    void missingCrop() {
        CropKnowledgeBase kb = new CropKnowledgeBase(Map.of(), CropPhenologyTest.threeStageRice());
        UnknownCropKindException ex = assertThrows(UnknownCropKindException.class,
            () -> kb.phenology(CropKind.TOMATO));
        assertEquals("tomato", ex.getCropKey());
    }

    @Test
    @DisplayName("unknown crop keys in the document are skipped, not fatal")
    void unknownKeySkipped() throws Exception {
        String json = """
            {
              "crops": {
                "millet": { "baseTemperature": 8, "totalGddToMaturity": 100,
                            "stages": [ { "name": "all", "upperGdd": 100 } ] },
                "rice":   { "baseTemperature": 10, "totalGddToMaturity": 100,
                            "stages": [ { "name": "all", "upperGdd": 100 } ] }
              },
              "generic": { "baseTemperature": 10, "totalGddToMaturity": 100,
                           "stages": [ { "name": "all", "upperGdd": 100 } ] }
            }
            """;
        CropKnowledgeBase kb = CropKnowledgeBase.read(mapper,
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        assertEquals(EnumSet.of(CropKind.RICE), kb.supportedCrops());
    }

    @Test
    @DisplayName("invalid stage table fails loading")
    void invalidTable() {
        String json = """
            { "generic": { "baseTemperature": 10, "totalGddToMaturity": 300,
                           "stages": [ { "name": "a", "upperGdd": 200 }, { "name": "b", "upperGdd": 100 } ] } }
            """;
        assertThrows(Exception.class, () -> CropKnowledgeBase.read(mapper,
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }
}
