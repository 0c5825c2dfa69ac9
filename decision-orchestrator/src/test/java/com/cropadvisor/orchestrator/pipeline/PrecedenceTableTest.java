package com.cropadvisor.orchestrator.pipeline;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.orchestrator.routing.PrecedenceClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.cropadvisor.common.model.EvaluatorId.*;
import static org.junit.jupiter.api.Assertions.*;

class PrecedenceTableTest {

    @Test
    @DisplayName("built-in orders per class")
    void defaults() {
        PrecedenceTable table = PrecedenceTable.defaults();

        assertEquals(List.of(WEATHER, RISK, CROP_STAGE, CONTEXT), table.order(PrecedenceClass.IRRIGATION));
        assertEquals(List.of(CROP_STAGE, RISK, WEATHER, CONTEXT), table.order(PrecedenceClass.STATUS));
        assertEquals(List.of(CONTEXT), table.order(PrecedenceClass.CONTEXT));
    }

    @Test
    @DisplayName("overrides replace only the named class")
    void overrides() {
        PrecedenceTable table = PrecedenceTable.withOverrides(Map.of("status", List.of(RISK, CROP_STAGE)));

        assertEquals(List.of(RISK, CROP_STAGE), table.order(PrecedenceClass.STATUS));
        assertEquals(List.of(WEATHER, RISK, CROP_STAGE, CONTEXT), table.order(PrecedenceClass.IRRIGATION));
    }

    @Test
    @DisplayName("duplicate evaluator in one class is rejected")
    void duplicates() {
        Map<String, List<EvaluatorId>> bad = Map.of("irrigation", List.of(WEATHER, WEATHER));
        assertThrows(IllegalArgumentException.class, () -> PrecedenceTable.withOverrides(bad));
    }

    @Test
    @DisplayName("unknown class name is rejected")
    void unknownClass() {
        Map<String, List<EvaluatorId>> bad = Map.of("harvest", List.of(WEATHER));
        assertThrows(IllegalArgumentException.class, () -> PrecedenceTable.withOverrides(bad));
    }
}
