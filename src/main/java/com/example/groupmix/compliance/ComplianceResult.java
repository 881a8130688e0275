package com.example.groupmix.compliance;

import java.util.List;
import java.util.Objects;

import com.example.groupmix.compliance.detail.DetailNormalizer;
import com.example.groupmix.compliance.detail.ViolationDetail;
import com.example.groupmix.domain.constraint.Constraint;
import com.example.groupmix.domain.constraint.ConstraintKind;

/**
 * Outcome of evaluating one constraint against one schedule.
 * A result adheres exactly when its violation count is zero.
 */
public class ComplianceResult {

    private final int constraintIndex;

    private final Constraint constraint;

    private final int violationsCount;

    private final List<ViolationDetail> details;

    private final boolean assumedSatisfied;

    public ComplianceResult(int constraintIndex, Constraint constraint, int violationsCount,
                            List<? extends ViolationDetail> details) {
        this(constraintIndex, constraint, violationsCount, details, false);
    }

    private ComplianceResult(int constraintIndex, Constraint constraint, int violationsCount,
                             List<? extends ViolationDetail> details, boolean assumedSatisfied) {
        if (violationsCount < 0) {
            throw new IllegalArgumentException("Violation count must not be negative: " + violationsCount);
        }
        this.constraintIndex = constraintIndex;
        this.constraint = Objects.requireNonNull(constraint, "constraint");
        this.violationsCount = violationsCount;
        this.details = List.copyOf(DetailNormalizer.distinct(details));
        this.assumedSatisfied = assumedSatisfied;
    }

    /**
     * Result for a constraint that could not be evaluated. It counts as satisfied, and
     * {@link #isAssumedSatisfied()} tells callers not to rely on that.
     */
    public static ComplianceResult assumedSatisfied(int constraintIndex, Constraint constraint) {
        return new ComplianceResult(constraintIndex, constraint, 0, List.of(), true);
    }

    public int getConstraintIndex() {
        return constraintIndex;
    }

    public Constraint getConstraint() {
        return constraint;
    }

    public ConstraintKind getKind() {
        return constraint.getKind();
    }

    public String getType() {
        return constraint.getTypeName();
    }

    public boolean isHard() {
        return constraint.isHard();
    }

    public boolean adheres() {
        return violationsCount == 0;
    }

    public int getViolationsCount() {
        return violationsCount;
    }

    public List<ViolationDetail> getDetails() {
        return details;
    }

    public boolean isAssumedSatisfied() {
        return assumedSatisfied;
    }

    public double getWeightedViolations() {
        return violationsCount * constraint.getPenaltyWeight();
    }

    @Override
    public String toString() {
        return "#" + constraintIndex + " " + getType() + (adheres() ? " ok" : " violations=" + violationsCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComplianceResult that = (ComplianceResult) o;
        return constraintIndex == that.constraintIndex
                && violationsCount == that.violationsCount
                && assumedSatisfied == that.assumedSatisfied
                && getType().equals(that.getType())
                && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(constraintIndex, getType(), violationsCount, details, assumedSatisfied);
    }
}
