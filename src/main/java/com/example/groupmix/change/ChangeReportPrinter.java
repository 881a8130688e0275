package com.example.groupmix.change;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

import ai.timefold.solver.core.api.score.buildin.hardsoftbigdecimal.HardSoftBigDecimalScore;

import com.example.groupmix.compliance.ComplianceReport;
import com.example.groupmix.compliance.ComplianceResult;
import com.example.groupmix.compliance.detail.ViolationDetail;
import com.example.groupmix.domain.ScoreSummary;

/**
 * Prints compliance and change reports to a console stream.
 * Shows at most a few findings per constraint.
 */
public class ChangeReportPrinter {

    private static final int MAX_DETAILS_PER_CONSTRAINT = 5;

    private final PrintStream out;

    public ChangeReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void printCompliance(ComplianceReport report) {
        out.println("📋 Constraint compliance");
        out.println("─".repeat(80));
        for (ComplianceResult result : report.getResults()) {
            String status;
            if (result.isAssumedSatisfied()) {
                status = "❔ unknown type, assumed satisfied";
            } else if (result.adheres()) {
                status = "✅ ok";
            } else {
                status = "❌ " + result.getViolationsCount() + " violation(s)";
            }
            out.printf("#%-3d %-24s %s%s%n", result.getConstraintIndex(), result.getKind().getLabel(),
                    status, result.isHard() ? " [hard]" : "");
        }
        out.println("Penalty score: " + report.getPenaltyScore());
        out.println("─".repeat(80));
    }

    public void printChange(ChangeReport report) {
        out.println("🔁 Proposed change");
        out.println("─".repeat(80));

        HardSoftBigDecimalScore delta = report.getScoreDelta();
        String verdict;
        if (delta.compareTo(HardSoftBigDecimalScore.ZERO) > 0) {
            verdict = " ⬆️ improvement";
        } else if (delta.compareTo(HardSoftBigDecimalScore.ZERO) < 0) {
            verdict = " ⬇️ regression";
        } else {
            verdict = " ➡️ (no change)";
        }
        out.printf(Locale.ROOT, "Weighted penalty delta: %s | Score delta: %s%s%n",
                signed(report.getAggregateScoreDelta()), delta, verdict);

        ScoreSummary summaryDelta = report.getScoreSummaryDelta();
        if (summaryDelta != null) {
            out.printf(Locale.ROOT, "Optimizer score: %.2f -> %.2f (%s), unique contacts %+d%n",
                    report.getBeforeScoreSummary().getFinalScore(), report.getAfterScoreSummary().getFinalScore(),
                    signed(summaryDelta.getFinalScore()), summaryDelta.getUniqueContacts());
        }

        if (report.getPerConstraintDelta().isEmpty()) {
            out.println("No constraint is affected.");
        }
        printSection("Hard constraints", report.getHardDeltas());
        printSection("Other constraints", report.getSoftDeltas());
        out.println("─".repeat(80));
    }

    private void printSection(String title, List<ConstraintDelta> deltas) {
        if (deltas.isEmpty()) {
            return;
        }
        out.println("  " + title + ":");
        for (ConstraintDelta delta : deltas) {
            out.printf(Locale.ROOT, "  #%-3d %-24s %d -> %d violations, weighted %s%n",
                    delta.getConstraintIndex(), delta.getKind().getLabel(),
                    delta.getBeforeCount(), delta.getAfterCount(), signed(delta.getWeightedDelta()));
            printDetails("+", delta.getAddedDetails());
            printDetails("-", delta.getRemovedDetails());
        }
    }

    private void printDetails(String marker, List<ViolationDetail> details) {
        details.stream()
                .limit(MAX_DETAILS_PER_CONSTRAINT)
                .forEach(d -> out.println("       " + marker + " " + d));
        if (details.size() > MAX_DETAILS_PER_CONSTRAINT) {
            out.println("       " + marker + " ... " + (details.size() - MAX_DETAILS_PER_CONSTRAINT) + " more");
        }
    }

    private static String signed(double value) {
        return (value > 0 ? "+" : "") + BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
