package com.example.groupmix.config;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationConfigFactoryTest {

    @Test
    void defaultsToSequentialEvaluation() {
        EvaluationConfig config = EvaluationConfigFactory.createConfig(new Properties());

        assertFalse(config.isParallel());
        assertEquals(EvaluationConfigFactory.DEFAULT_PARALLEL_THRESHOLD, config.getParallelThreshold());
        assertFalse(config.shouldRunInParallel(1000));
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(EvaluationConfigFactory.PARALLEL_PROPERTY, "true");
        properties.setProperty(EvaluationConfigFactory.PARALLEL_THRESHOLD_PROPERTY, " 4 ");

        EvaluationConfig config = EvaluationConfigFactory.createConfig(properties);

        assertTrue(config.isParallel());
        assertEquals(4, config.getParallelThreshold());
        assertFalse(config.shouldRunInParallel(3));
        assertTrue(config.shouldRunInParallel(4));
    }

    @Test
    void rejectsMalformedThreshold() {
        Properties properties = new Properties();
        properties.setProperty(EvaluationConfigFactory.PARALLEL_THRESHOLD_PROPERTY, "many");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EvaluationConfigFactory.createConfig(properties));
        assertTrue(e.getMessage().contains(EvaluationConfigFactory.PARALLEL_THRESHOLD_PROPERTY));
    }

    @Test
    void rejectsThresholdBelowOne() {
        Properties properties = new Properties();
        properties.setProperty(EvaluationConfigFactory.PARALLEL_THRESHOLD_PROPERTY, "0");

        assertThrows(IllegalArgumentException.class, () -> EvaluationConfigFactory.createConfig(properties));
    }

    @Test
    void withersReturnAdjustedCopies() {
        EvaluationConfig defaults = EvaluationConfig.defaults();
        EvaluationConfig tuned = defaults.withParallel(true).withParallelThreshold(2);

        assertFalse(defaults.isParallel());
        assertTrue(tuned.isParallel());
        assertEquals(2, tuned.getParallelThreshold());
    }
}
