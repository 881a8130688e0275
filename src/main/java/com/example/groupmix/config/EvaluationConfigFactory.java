package com.example.groupmix.config;

import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple evaluation configuration factory.
 * Defaults can be overridden with system properties.
 */
public class EvaluationConfigFactory {

    public static final String PARALLEL_PROPERTY = "groupmix.evaluation.parallel";
    public static final String PARALLEL_THRESHOLD_PROPERTY = "groupmix.evaluation.parallel-threshold";

    // Below this many constraints a parallel stream costs more than it saves
    static final int DEFAULT_PARALLEL_THRESHOLD = 16;

    private static final Logger log = LoggerFactory.getLogger(EvaluationConfigFactory.class);

    // Private constructor to prevent instantiation
    private EvaluationConfigFactory() {
    }

    /**
     * Creates the evaluation configuration from the JVM system properties.
     */
    public static EvaluationConfig createConfig() {
        return createConfig(System.getProperties());
    }

    public static EvaluationConfig createConfig(Properties properties) {
        boolean parallel = Boolean.parseBoolean(properties.getProperty(PARALLEL_PROPERTY, "false"));
        int threshold = DEFAULT_PARALLEL_THRESHOLD;
        String rawThreshold = properties.getProperty(PARALLEL_THRESHOLD_PROPERTY);
        if (rawThreshold != null) {
            try {
                threshold = Integer.parseInt(rawThreshold.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + PARALLEL_THRESHOLD_PROPERTY
                        + " must be an integer, got '" + rawThreshold + "'", e);
            }
        }
        EvaluationConfig config = new EvaluationConfig(parallel, threshold);
        log.debug("Using {}", config);
        return config;
    }
}
