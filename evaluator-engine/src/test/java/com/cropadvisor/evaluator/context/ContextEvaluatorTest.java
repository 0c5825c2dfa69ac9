package com.cropadvisor.evaluator.context;

import com.cropadvisor.common.model.CropKind;
import com.cropadvisor.common.model.CropRecord;
import com.cropadvisor.common.model.FarmProfile;
import com.cropadvisor.common.model.GeoLocation;
import com.cropadvisor.common.model.Intent;
import com.cropadvisor.common.model.IrrigationType;
import com.cropadvisor.common.phenology.CropKnowledgeBase;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextEvaluatorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 7, 10);
    private static final FarmProfile PROFILE = new FarmProfile(42L, 2.5, IrrigationType.DRIP,
        new GeoLocation(16.3, 80.45, "Guntur"), "te");

    private final ContextEvaluator evaluator = new ContextEvaluator(
        CropKnowledgeBase.fromClasspath(new ObjectMapper(), CropKnowledgeBase.DEFAULT_RESOURCE));

    private ContextReport run(Intent intent, CropRecord crop, Map<String, String> entities) {
        return evaluator.evaluate(new FarmSnapshot(42L, PROFILE, crop, intent, entities, AS_OF)).block();
    }

    @Test
    @DisplayName("status summary covers farm and active crop")
    void summary() {
        CropRecord crop = new CropRecord(1L, 42L, CropKind.RICE, null, AS_OF.minusDays(30), 540.0,
                                         AS_OF.minusDays(1), "panicle_initiation", 0.1, 0.3, 3L, true);
        ContextReport report = run(Intent.CROP_STATUS_QUERY, crop, Map.of());

        assertNotNull(report);
        assertEquals("2.5 acres, drip irrigation, Guntur, rice at panicle_initiation (30% to maturity), "
                     + "day 30 after sowing", report.summary());
        assertFalse(report.hasRegistration());
    }

    @Nested
    @DisplayName("crop onboarding")
    class Onboarding {

        @Test
        @DisplayName("crop type and sowing date become a registration at the first stage")
        void proposesRegistration() {
            ContextReport report = run(Intent.CROP_ONBOARDING_INTENT, null,
                Map.of("crop_type", "Wheat", "sowing_date", "2024-07-01"));

            assertNotNull(report);
            assertTrue(report.hasRegistration());
            assertEquals(CropKind.WHEAT, report.proposedRegistration().cropKind());
            assertEquals(LocalDate.of(2024, 7, 1), report.proposedRegistration().sowingDate());
            assertEquals("germination", report.proposedRegistration().initialStage());
        }

        @Test
        @DisplayName("missing sowing date defaults to today")
        void defaultSowingDate() {
            ContextReport report = run(Intent.CROP_ONBOARDING_INTENT, null, Map.of("crop_type", "corn"));
            assertNotNull(report);
            assertEquals(AS_OF, report.proposedRegistration().sowingDate());
            assertEquals(CropKind.MAIZE, report.proposedRegistration().cropKind());
        }

        @Test
        @DisplayName("unsupported crop is reported, not registered")
        void unsupportedCrop() {
            ContextReport report = run(Intent.CROP_ONBOARDING_INTENT, null, Map.of("crop_type", "saffron"));
            assertNotNull(report);
            assertFalse(report.hasRegistration());
            assertEquals("crop 'saffron' is not supported", report.registrationProblem());
        }

        @Test
        @DisplayName("future sowing date is rejected")
        void futureDate() {
            ContextReport report = run(Intent.CROP_ONBOARDING_INTENT, null,
                Map.of("crop_type", "rice", "sowing_date", "2024-08-01"));
            assertNotNull(report);
            assertFalse(report.hasRegistration());
            assertNotNull(report.registrationProblem());
        }
    }
}
