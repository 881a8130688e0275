package com.example.groupmix.compliance;

import java.math.BigDecimal;
import java.util.List;

import ai.timefold.solver.core.api.score.buildin.hardsoftbigdecimal.HardSoftBigDecimalScore;

/**
 * Per-constraint evaluation of one schedule, in constraint-list order.
 * Never mutated after it is built.
 */
public class ComplianceReport {

    private final List<ComplianceResult> results;

    public ComplianceReport(List<ComplianceResult> results) {
        this.results = List.copyOf(results);
        for (int i = 0; i < this.results.size(); i++) {
            if (this.results.get(i).getConstraintIndex() != i) {
                throw new IllegalArgumentException("Result at position " + i + " belongs to constraint #"
                        + this.results.get(i).getConstraintIndex());
            }
        }
    }

    public List<ComplianceResult> getResults() {
        return results;
    }

    public ComplianceResult get(int constraintIndex) {
        return results.get(constraintIndex);
    }

    public int size() {
        return results.size();
    }

    public boolean isFullyCompliant() {
        return results.stream().allMatch(ComplianceResult::adheres);
    }

    public int getTotalViolations() {
        return results.stream().mapToInt(ComplianceResult::getViolationsCount).sum();
    }

    /**
     * Violations as a Timefold score: hard constraints count one hard point per violation,
     * soft constraints their weighted violations, both negated so that zero is best.
     */
    public HardSoftBigDecimalScore getPenaltyScore() {
        BigDecimal hard = BigDecimal.ZERO;
        BigDecimal soft = BigDecimal.ZERO;
        for (ComplianceResult result : results) {
            BigDecimal weighted = BigDecimal.valueOf(result.getConstraint().getPenaltyWeight())
                    .multiply(BigDecimal.valueOf(result.getViolationsCount()));
            if (result.isHard()) {
                hard = hard.subtract(weighted);
            } else {
                soft = soft.subtract(weighted);
            }
        }
        return HardSoftBigDecimalScore.of(hard, soft);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return results.equals(((ComplianceReport) o).results);
    }

    @Override
    public int hashCode() {
        return results.hashCode();
    }

    @Override
    public String toString() {
        return "ComplianceReport" + results;
    }
}
