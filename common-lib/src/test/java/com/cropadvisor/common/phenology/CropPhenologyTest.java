package com.cropadvisor.common.phenology;

import com.cropadvisor.common.model.CropPhase;
import com.cropadvisor.common.model.WaterNeed;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CropPhenologyTest {

    static CropPhenology threeStageRice() {
        return new CropPhenology(10.0, 500.0, List.of(
            new StageBoundary("germination", 50,  WaterNeed.MEDIUM, false, CropPhase.ESTABLISHMENT, "emergence"),
            new StageBoundary("seedling",    150, WaterNeed.MEDIUM, false, CropPhase.ESTABLISHMENT, "leaves"),
            new StageBoundary("vegetative",  500, WaterNeed.HIGH,   false, CropPhase.VEGETATIVE,    "tillering")));
    }

    @Nested
    @DisplayName("position()")
    class Position {

        @Test
        @DisplayName("270 GDD lands in vegetative at about a third of the way")
        void vegetativeScenario() {
            StagePosition position = threeStageRice().position(270.0);
            assertEquals("vegetative", position.stageName());
            assertEquals(120.0 / 350.0, position.stageProgress(), 1e-9);
            assertEquals(230.0, position.gddToNextStage(), 1e-9);
            assertEquals(0.54, position.overallProgress(), 1e-9);
        }

        @Test
        @DisplayName("zero GDD is the first stage at progress 0")
        void zero() {
            StagePosition position = threeStageRice().position(0.0);
            assertEquals(0, position.stageIndex());
            assertEquals(0.0, position.stageProgress(), 1e-9);
        }

        @Test
        @DisplayName("a bound belongs to the next stage")
        void lowerBoundInclusive() {
            StagePosition position = threeStageRice().position(150.0);
            assertEquals("vegetative", position.stageName());
            assertEquals(0.0, position.stageProgress(), 1e-9);
        }

        @Test
        @DisplayName("beyond the last bound stays in the last stage at progress 1")
        void beyondLast() {
            StagePosition position = threeStageRice().position(900.0);
            assertEquals("vegetative", position.stageName());
            assertEquals(1.0, position.stageProgress(), 1e-9);
            assertEquals(1.0, position.overallProgress(), 1e-9);
            assertEquals(0.0, position.gddToNextStage(), 1e-9);
        }

        @Test
        @DisplayName("stage index never decreases as GDD grows")
        void monotonic() {
            CropPhenology phenology = threeStageRice();
            int previous = 0;
            for (double gdd = 0; gdd <= 600; gdd += 7.5) {
                int index = phenology.position(gdd).stageIndex();
                assertTrue(index >= previous, "stage went backwards at gdd=" + gdd);
                previous = index;
            }
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void nonIncreasingBoundsRejected() {
            assertThrows(IllegalArgumentException.class, () -> new CropPhenology(10.0, 150.0, List.of(
                new StageBoundary("a", 100, null, false, null, null),
                new StageBoundary("b", 100, null, false, null, null))));
        }

        @Test
        void lastBoundMustEqualTotal() {
            assertThrows(IllegalArgumentException.class, () -> new CropPhenology(10.0, 900.0, List.of(
                new StageBoundary("a", 100, null, false, null, null),
                new StageBoundary("b", 200, null, false, null, null))));
        }

        @Test
        void emptyTableRejected() {
            assertThrows(IllegalArgumentException.class, () -> new CropPhenology(10.0, 100.0, List.of()));
        }
    }
}
