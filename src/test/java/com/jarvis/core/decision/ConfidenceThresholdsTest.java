package com.jarvis.core.decision;

import com.jarvis.core.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceThresholdsTest {

    @Test
    @DisplayName("defaults are 0.7, 0.8, 0.9 and 1.0")
    void defaults() {
        var thresholds = ConfidenceThresholds.defaults();

        assertEquals(0.7, thresholds.get(RiskLevel.LOW));
        assertEquals(0.8, thresholds.get(RiskLevel.MEDIUM));
        assertEquals(0.9, thresholds.get(RiskLevel.HIGH));
        assertEquals(1.0, thresholds.get(RiskLevel.CRITICAL));
    }

    @Test
    @DisplayName("non-increasing or out of range values are refused")
    void invalidConfiguration() {
        assertThrows(IllegalStateException.class, () -> new ConfidenceThresholds(0.8, 0.8, 0.9, 1.0));
        assertThrows(IllegalStateException.class, () -> new ConfidenceThresholds(0.9, 0.8, 0.95, 1.0));
        assertThrows(IllegalStateException.class, () -> new ConfidenceThresholds(0.7, 0.8, 0.9, 1.1));
        assertThrows(IllegalStateException.class, () -> new ConfidenceThresholds(-0.1, 0.8, 0.9, 1.0));
    }

    @Test
    @DisplayName("raise moves one level up by the step")
    void raise() {
        var thresholds = ConfidenceThresholds.defaults();

        assertTrue(thresholds.raise(RiskLevel.LOW, 0.02, 0.95));

        assertEquals(0.72, thresholds.get(RiskLevel.LOW), 1e-9);
        assertEquals(0.8, thresholds.get(RiskLevel.MEDIUM));
    }

    @Test
    @DisplayName("raise is capped at the ceiling")
    void ceiling() {
        var thresholds = new ConfidenceThresholds(0.5, 0.6, 0.94, 1.0);

        assertTrue(thresholds.raise(RiskLevel.HIGH, 0.05, 0.95));
        assertEquals(0.95, thresholds.get(RiskLevel.HIGH), 1e-9);
        assertFalse(thresholds.raise(RiskLevel.HIGH, 0.05, 0.95));
    }

    @Test
    @DisplayName("raise never reaches the next level's threshold")
    void staysBelowNextLevel() {
        var thresholds = new ConfidenceThresholds(0.7, 0.71, 0.9, 1.0);

        assertFalse(thresholds.raise(RiskLevel.LOW, 0.02, 0.95));
        assertEquals(0.7, thresholds.get(RiskLevel.LOW));
    }

    @Test
    @DisplayName("repeated raises keep the levels strictly increasing")
    void monotonicUnderRepeatedRaises() {
        var thresholds = ConfidenceThresholds.defaults();
        for (int i = 0; i < 50; i++) {
            for (RiskLevel level : RiskLevel.values()) {
                thresholds.raise(level, 0.02, 0.95);
            }
        }

        var snapshot = thresholds.snapshot();
        assertTrue(snapshot.get(RiskLevel.LOW) < snapshot.get(RiskLevel.MEDIUM));
        assertTrue(snapshot.get(RiskLevel.MEDIUM) < snapshot.get(RiskLevel.HIGH));
        assertTrue(snapshot.get(RiskLevel.HIGH) < snapshot.get(RiskLevel.CRITICAL));
    }
}
