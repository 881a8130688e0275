package com.example.groupmix.domain.constraint;

import java.util.Objects;

/**
 * Limits how often the same two people share a group across all sessions.
 */
public class RepeatEncounterConstraint extends Constraint {

    private final int maxAllowedEncounters;

    private final PenaltyFunction penaltyFunction;

    private final double penaltyWeight;

    public RepeatEncounterConstraint(int maxAllowedEncounters, PenaltyFunction penaltyFunction, double penaltyWeight) {
        if (maxAllowedEncounters < 0) {
            throw new IllegalArgumentException("maxAllowedEncounters must not be negative: " + maxAllowedEncounters);
        }
        this.maxAllowedEncounters = maxAllowedEncounters;
        this.penaltyFunction = Objects.requireNonNull(penaltyFunction, "penaltyFunction");
        this.penaltyWeight = checkWeight(penaltyWeight);
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.REPEAT_ENCOUNTER;
    }

    public int getMaxAllowedEncounters() {
        return maxAllowedEncounters;
    }

    public PenaltyFunction getPenaltyFunction() {
        return penaltyFunction;
    }

    @Override
    public double getPenaltyWeight() {
        return penaltyWeight;
    }

    @Override
    public String toString() {
        return getTypeName() + "(max " + maxAllowedEncounters + ", " + penaltyFunction + ")";
    }
}
