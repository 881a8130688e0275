package com.example.groupmix.config;

/**
 * Settings for compliance evaluation.
 */
public class EvaluationConfig {

    private final boolean parallel;

    private final int parallelThreshold;

    public EvaluationConfig(boolean parallel, int parallelThreshold) {
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("Parallel threshold must be at least 1, got " + parallelThreshold);
        }
        this.parallel = parallel;
        this.parallelThreshold = parallelThreshold;
    }

    public static EvaluationConfig defaults() {
        return new EvaluationConfig(false, EvaluationConfigFactory.DEFAULT_PARALLEL_THRESHOLD);
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public boolean shouldRunInParallel(int constraintCount) {
        return parallel && constraintCount >= parallelThreshold;
    }

    public EvaluationConfig withParallel(boolean parallel) {
        return new EvaluationConfig(parallel, parallelThreshold);
    }

    public EvaluationConfig withParallelThreshold(int parallelThreshold) {
        return new EvaluationConfig(parallel, parallelThreshold);
    }

    @Override
    public String toString() {
        return "EvaluationConfig{parallel=" + parallel + ", parallelThreshold=" + parallelThreshold + "}";
    }
}
