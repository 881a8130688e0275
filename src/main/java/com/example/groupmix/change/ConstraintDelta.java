package com.example.groupmix.change;

import java.util.List;

import com.example.groupmix.compliance.detail.ViolationDetail;
import com.example.groupmix.domain.constraint.ConstraintKind;

/**
 * How one constraint's evaluation moved between two schedules.
 */
public class ConstraintDelta {

    private final int constraintIndex;

    private final String type;

    private final ConstraintKind kind;

    private final boolean hard;

    private final int beforeCount;

    private final int afterCount;

    private final List<ViolationDetail> addedDetails;

    private final List<ViolationDetail> removedDetails;

    private final double weightedDelta;

    public ConstraintDelta(int constraintIndex, String type, ConstraintKind kind, boolean hard,
                           int beforeCount, int afterCount,
                           List<ViolationDetail> addedDetails, List<ViolationDetail> removedDetails,
                           double weightedDelta) {
        this.constraintIndex = constraintIndex;
        this.type = type;
        this.kind = kind;
        this.hard = hard;
        this.beforeCount = beforeCount;
        this.afterCount = afterCount;
        this.addedDetails = List.copyOf(addedDetails);
        this.removedDetails = List.copyOf(removedDetails);
        this.weightedDelta = weightedDelta;
    }

    public int getConstraintIndex() {
        return constraintIndex;
    }

    public String getType() {
        return type;
    }

    public ConstraintKind getKind() {
        return kind;
    }

    public boolean isHard() {
        return hard;
    }

    public int getBeforeCount() {
        return beforeCount;
    }

    public int getAfterCount() {
        return afterCount;
    }

    public int getViolationsDelta() {
        return afterCount - beforeCount;
    }

    /**
     * Findings present after the change but not before.
     */
    public List<ViolationDetail> getAddedDetails() {
        return addedDetails;
    }

    /**
     * Findings present before the change but gone after it.
     */
    public List<ViolationDetail> getRemovedDetails() {
        return removedDetails;
    }

    /**
     * Violation count delta times the constraint weight; positive means worse.
     */
    public double getWeightedDelta() {
        return weightedDelta;
    }

    /**
     * True when the count moved or the set of findings differs. The count can move while
     * the findings stay the same, e.g. a pair meeting once more.
     */
    public boolean isChanged() {
        return beforeCount != afterCount || !addedDetails.isEmpty() || !removedDetails.isEmpty();
    }

    @Override
    public String toString() {
        return "#" + constraintIndex + " " + type + " " + beforeCount + "->" + afterCount
                + " (+" + addedDetails.size() + "/-" + removedDetails.size() + ", weighted " + weightedDelta + ")";
    }
}
