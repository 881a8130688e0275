package com.example.groupmix.change;

import java.util.List;
import java.util.stream.Collectors;

import ai.timefold.solver.core.api.score.buildin.hardsoftbigdecimal.HardSoftBigDecimalScore;

import com.example.groupmix.domain.ScoreSummary;

/**
 * Structural diff between the compliance of a schedule before and after a proposed edit.
 * Hard-constraint deltas come first, then soft ones, each in constraint-list order.
 */
public class ChangeReport {

    private final ScoreSummary beforeScoreSummary;

    private final ScoreSummary afterScoreSummary;

    private final List<ConstraintDelta> perConstraintDelta;

    private final double aggregateScoreDelta;

    private final HardSoftBigDecimalScore scoreDelta;

    public ChangeReport(ScoreSummary beforeScoreSummary, ScoreSummary afterScoreSummary,
                        List<ConstraintDelta> perConstraintDelta, double aggregateScoreDelta,
                        HardSoftBigDecimalScore scoreDelta) {
        this.beforeScoreSummary = beforeScoreSummary;
        this.afterScoreSummary = afterScoreSummary;
        this.perConstraintDelta = List.copyOf(perConstraintDelta);
        this.aggregateScoreDelta = aggregateScoreDelta;
        this.scoreDelta = scoreDelta;
    }

    /**
     * @return the optimizer's score before the change, or null when none was supplied
     */
    public ScoreSummary getBeforeScoreSummary() {
        return beforeScoreSummary;
    }

    public ScoreSummary getAfterScoreSummary() {
        return afterScoreSummary;
    }

    /**
     * @return {@code after - before}, or null unless both summaries were supplied
     */
    public ScoreSummary getScoreSummaryDelta() {
        if (beforeScoreSummary == null || afterScoreSummary == null) {
            return null;
        }
        return afterScoreSummary.minus(beforeScoreSummary);
    }

    public List<ConstraintDelta> getPerConstraintDelta() {
        return perConstraintDelta;
    }

    public List<ConstraintDelta> getHardDeltas() {
        return perConstraintDelta.stream().filter(ConstraintDelta::isHard).collect(Collectors.toList());
    }

    public List<ConstraintDelta> getSoftDeltas() {
        return perConstraintDelta.stream().filter(d -> !d.isHard()).collect(Collectors.toList());
    }

    /**
     * Sum of the weighted deltas of all constraints. Positive means the change adds penalty.
     */
    public double getAggregateScoreDelta() {
        return aggregateScoreDelta;
    }

    /**
     * Penalty score after minus penalty score before. Above zero the change is an improvement.
     */
    public HardSoftBigDecimalScore getScoreDelta() {
        return scoreDelta;
    }

    public boolean hasChanges() {
        return perConstraintDelta.stream().anyMatch(ConstraintDelta::isChanged);
    }

    @Override
    public String toString() {
        return "ChangeReport{aggregate=" + aggregateScoreDelta + ", deltas=" + perConstraintDelta + "}";
    }
}
