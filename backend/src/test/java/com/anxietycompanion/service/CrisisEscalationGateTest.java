package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.AnalysisSource;
import com.anxietycompanion.model.domain.Assessment;
import com.anxietycompanion.model.domain.CrisisRisk;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrisisEscalationGateTest {

    private final CrisisEscalationGate gate = new CrisisEscalationGate();

    @Test
    void shouldEscalateOnExplicitCrisisLanguage() {
        assertTrue(gate.shouldEscalate("Sometimes I want to end my life", null, 0));
        assertTrue(gate.shouldEscalate("Quiero morir", null, 0));
    }

    @Test
    void shouldEscalateOnSevereRisk() {
        assertTrue(gate.shouldEscalate("I can't cope", assessment(9, CrisisRisk.HIGH), 1));
        assertTrue(gate.shouldEscalate("I can't cope", assessment(5, CrisisRisk.CRITICAL), 0));
    }

    @Test
    void shouldNotEscalateOnSingleHighReading() {
        assertFalse(gate.shouldEscalate("Everything is too much", assessment(8, CrisisRisk.MODERATE), 1));
    }

    @Test
    void shouldEscalateOnRepeatedHighReadings() {
        assertTrue(gate.shouldEscalate("Everything is too much", assessment(8, CrisisRisk.MODERATE), 2));
    }

    @Test
    void shouldTreatMissingAssessmentAsAbsent() {
        assertFalse(gate.shouldEscalate("Hello", null, 0));
        assertFalse(gate.shouldEscalate(null, null, 1));
    }

    private Assessment assessment(int level, CrisisRisk risk) {
        return Assessment.builder()
                .anxietyLevel(level)
                .personalizedResponse("Breathe with me for a moment.")
                .source(AnalysisSource.FALLBACK)
                .crisisRisk(risk)
                .build();
    }
}
