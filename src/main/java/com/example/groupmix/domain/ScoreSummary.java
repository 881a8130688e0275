package com.example.groupmix.domain;

import java.util.Locale;

/**
 * Score breakdown reported by the optimizer for a solution. Lower final scores are better.
 */
public class ScoreSummary {

    private final double finalScore;

    private final int uniqueContacts;

    private final int repetitionPenalty;

    private final double attributeBalancePenalty;

    private final int constraintPenalty;

    public ScoreSummary(double finalScore, int uniqueContacts, int repetitionPenalty,
                        double attributeBalancePenalty, int constraintPenalty) {
        this.finalScore = finalScore;
        this.uniqueContacts = uniqueContacts;
        this.repetitionPenalty = repetitionPenalty;
        this.attributeBalancePenalty = attributeBalancePenalty;
        this.constraintPenalty = constraintPenalty;
    }

    public double getFinalScore() {
        return finalScore;
    }

    public int getUniqueContacts() {
        return uniqueContacts;
    }

    public int getRepetitionPenalty() {
        return repetitionPenalty;
    }

    public double getAttributeBalancePenalty() {
        return attributeBalancePenalty;
    }

    public int getConstraintPenalty() {
        return constraintPenalty;
    }

    /**
     * Field-wise difference {@code this - other}.
     */
    public ScoreSummary minus(ScoreSummary other) {
        return new ScoreSummary(
                finalScore - other.finalScore,
                uniqueContacts - other.uniqueContacts,
                repetitionPenalty - other.repetitionPenalty,
                attributeBalancePenalty - other.attributeBalancePenalty,
                constraintPenalty - other.constraintPenalty);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "score=%.2f, uniqueContacts=%d, repetition=%d, attributeBalance=%.2f, constraints=%d",
                finalScore, uniqueContacts, repetitionPenalty, attributeBalancePenalty, constraintPenalty);
    }
}
