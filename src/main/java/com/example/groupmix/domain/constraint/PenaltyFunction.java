package com.example.groupmix.domain.constraint;

/**
 * How the optimizer scales repeat-encounter excess. The compliance evaluator
 * always reports the raw excess regardless of this setting.
 */
public enum PenaltyFunction {
    LINEAR,
    SQUARED
}
