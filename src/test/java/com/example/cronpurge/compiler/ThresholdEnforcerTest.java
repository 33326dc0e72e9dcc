package com.example.cronpurge.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cronpurge.config.JobThresholdProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ThresholdEnforcerTest {

    private JobThresholdProperties properties;
    private ThresholdEnforcer enforcer;

    @BeforeEach
    void setUp() {
        properties = new JobThresholdProperties();
        enforcer = new ThresholdEnforcer(properties);
    }

    @ParameterizedTest
    @CsvSource({
            "-5, 60, 60",
            "0, 60, 60",
            "59, 60, 60",
            "60, 60, 60",
            "61, 60, 61",
            "2147483647, 100, 2147483647",
            "-2147483648, 100, 100"
    })
    @DisplayName("clamp never goes below the minimum and keeps values at or above it")
    void clamp(int value, int minimum, int expected) {
        int clamped = ThresholdEnforcer.clamp(value, minimum);

        assertEquals(expected, clamped);
        assertTrue(clamped >= minimum);
    }

    @Test
    @DisplayName("defaults are 60 days and 100 rows")
    void defaults() {
        assertEquals(60, properties.getMinRetentionDays());
        assertEquals(100, properties.getMinLimit());
    }

    @Test
    @DisplayName("limit below minimum is raised and reported")
    void limitRaised() {
        ThresholdEnforcer.Clamped clamped = enforcer.limit(5);

        assertEquals(5, clamped.requested());
        assertEquals(100, clamped.effective());
        assertTrue(clamped.raised());
    }

    @Test
    @DisplayName("missing limit falls back to the minimum")
    void missingLimit() {
        ThresholdEnforcer.Clamped clamped = enforcer.limit(null);

        assertEquals(100, clamped.effective());
        assertTrue(clamped.raised());
    }

    @Test
    @DisplayName("retention days honour configured minimum")
    void configuredRetentionMinimum() {
        properties.setMinRetentionDays(30);

        ThresholdEnforcer.Clamped clamped = enforcer.retentionDays(45);

        assertEquals(45, clamped.effective());
        assertFalse(clamped.raised());
        assertEquals(30, enforcer.retentionDays(10).effective());
    }
}
