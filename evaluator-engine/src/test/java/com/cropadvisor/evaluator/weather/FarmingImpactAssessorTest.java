package com.cropadvisor.evaluator.weather;

import com.cropadvisor.common.model.FarmingImpact;
import com.cropadvisor.common.model.WeatherCondition;
import com.cropadvisor.common.model.WeatherSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cropadvisor.evaluator.weather.WeatherFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FarmingImpactAssessorTest {

    private final FarmingImpactAssessor assessor = new FarmingImpactAssessor(WeatherThresholds.defaults());

    @Nested
    @DisplayName("rain risk")
    class RainRisk {

        @Test
        @DisplayName("80 % probability today gives 0.8, irrigation not needed, spraying unsafe")
        void rainExpected() {
            FarmingImpact impact = assessor.assess(rainToday(80.0, 12.0));
            assertEquals(0.8, impact.rainRisk(), 1e-9);
            assertFalse(impact.irrigationNeeded());
            assertFalse(impact.spraySafe());
        }

        @Test
        @DisplayName("probability is rounded to a whole percent")
        void rounded() {
            assertEquals(0.43, assessor.assess(rainToday(42.6, 0.0)).rainRisk(), 1e-9);
        }

        @Test
        @DisplayName("raining right now lifts rain risk to at least 0.9")
        void rainingNow() {
            WeatherSnapshot wet = snapshot(90.0, 2.5, 5.0, WeatherCondition.RAINY,
                List.of(day(0, 29.0, 0.0, 20.0)));
            FarmingImpact impact = assessor.assess(wet);
            assertEquals(0.9, impact.rainRisk(), 1e-9);
            assertFalse(impact.fieldWorkSafe());
        }
    }

    @Nested
    @DisplayName("heat stress")
    class HeatStress {

        @Test
        void high() {
            assertEquals(0.9, assessor.assess(dryWeek(39.0)).heatStressRisk(), 1e-9);
        }

        @Test
        void medium() {
            assertEquals(0.6, assessor.assess(dryWeek(36.0)).heatStressRisk(), 1e-9);
        }

        @Test
        void low() {
            assertEquals(0.3, assessor.assess(dryWeek(33.0)).heatStressRisk(), 1e-9);
        }

        @Test
        @DisplayName("35 °C exactly is not above the medium threshold")
        void boundary() {
            assertEquals(0.3, assessor.assess(dryWeek(35.0)).heatStressRisk(), 1e-9);
        }

        @Test
        @DisplayName("only the first three days count")
        void lookahead() {
            WeatherSnapshot lateHeat = snapshot(40.0, 0.0, 5.0, WeatherCondition.CLEAR, List.of(
                day(0, 30.0, 0, 0), day(1, 30.0, 0, 0), day(2, 30.0, 0, 0), day(3, 41.0, 0, 0)));
            assertEquals(0.0, assessor.assess(lateHeat).heatStressRisk(), 1e-9);
        }
    }

    @Test
    @DisplayName("dry calm week with low humidity needs irrigation and allows spraying")
    void dryWeekNeedsIrrigation() {
        FarmingImpact impact = assessor.assess(dryWeek(30.0));
        assertTrue(impact.irrigationNeeded());
        assertTrue(impact.spraySafe());
        assertTrue(impact.fieldWorkSafe());
    }

    @Test
    @DisplayName("humid air suppresses the irrigation flag")
    void humid() {
        WeatherSnapshot humid = snapshot(70.0, 0.0, 5.0, WeatherCondition.CLEAR, dryWeek(30.0).forecast());
        assertFalse(assessor.assess(humid).irrigationNeeded());
    }

    @Test
    @DisplayName("wind of 15 km/h already makes spraying unsafe")
    void sprayWind() {
        WeatherSnapshot windy = snapshot(40.0, 0.0, 15.0, WeatherCondition.CLEAR, dryWeek(30.0).forecast());
        assertFalse(assessor.assess(windy).spraySafe());
    }

    @Test
    @DisplayName("storm blocks field work")
    void storm() {
        WeatherSnapshot storm = snapshot(40.0, 0.0, 5.0, WeatherCondition.STORMY, dryWeek(30.0).forecast());
        assertFalse(assessor.assess(storm).fieldWorkSafe());
    }
}
