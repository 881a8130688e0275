package com.example.groupmix.change;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.groupmix.compliance.ComplianceReport;
import com.example.groupmix.compliance.ComplianceResult;
import com.example.groupmix.compliance.detail.DetailKey;
import com.example.groupmix.compliance.detail.DetailNormalizer;
import com.example.groupmix.compliance.detail.ViolationDetail;
import com.example.groupmix.domain.ScoreSummary;

/**
 * Compares two compliance reports of the same problem and lists, per constraint, which
 * findings appeared or disappeared and how the weighted penalty moved.
 *
 * <p>Weighted deltas are linear in the violation count, whatever penalty function a
 * repeat-encounter constraint declares. Each side is weighted with its own constraint's
 * weight, so a constraint re-weighted at the same index still diffs antisymmetrically.
 */
public class ChangeDiffEngine {

    private static final Logger log = LoggerFactory.getLogger(ChangeDiffEngine.class);

    public ChangeReport diff(ComplianceReport before, ComplianceReport after) {
        return diff(before, null, after, null);
    }

    public ChangeReport diff(ComplianceReport before, ScoreSummary beforeScore,
                             ComplianceReport after, ScoreSummary afterScore) {
        checkCompatible(before, after);

        List<ConstraintDelta> hard = new ArrayList<>();
        List<ConstraintDelta> soft = new ArrayList<>();
        double aggregate = 0.0;

        for (int i = 0; i < after.size(); i++) {
            ComplianceResult previous = before.get(i);
            ComplianceResult current = after.get(i);
            ConstraintDelta delta = compare(previous, current);
            aggregate += delta.getWeightedDelta();

            if (delta.isHard()) {
                // hard constraints stay visible while either side violates them
                if (delta.isChanged() || !previous.adheres() || !current.adheres()) {
                    hard.add(delta);
                }
            } else if (delta.isChanged()) {
                soft.add(delta);
            }
        }

        List<ConstraintDelta> ordered = new ArrayList<>(hard.size() + soft.size());
        ordered.addAll(hard);
        ordered.addAll(soft);

        log.debug("Diffed {} constraints: {} hard and {} soft deltas, aggregate {}",
                after.size(), hard.size(), soft.size(), aggregate);
        return new ChangeReport(beforeScore, afterScore, ordered, aggregate,
                after.getPenaltyScore().subtract(before.getPenaltyScore()));
    }

    ConstraintDelta compare(ComplianceResult before, ComplianceResult after) {
        Map<DetailKey, ViolationDetail> beforeByKey = DetailNormalizer.index(before.getDetails());
        Set<DetailKey> seen = new HashSet<>();
        List<ViolationDetail> added = new ArrayList<>();
        for (ViolationDetail detail : after.getDetails()) {
            DetailKey key = detail.key();
            seen.add(key);
            if (!beforeByKey.containsKey(key)) {
                added.add(detail);
            }
        }
        List<ViolationDetail> removed = new ArrayList<>();
        beforeByKey.forEach((key, detail) -> {
            if (!seen.contains(key)) {
                removed.add(detail);
            }
        });

        double weighted = after.getWeightedViolations() - before.getWeightedViolations();
        return new ConstraintDelta(after.getConstraintIndex(), after.getType(), after.getKind(), after.isHard(),
                before.getViolationsCount(), after.getViolationsCount(), added, removed, weighted);
    }

    private static void checkCompatible(ComplianceReport before, ComplianceReport after) {
        if (before.size() != after.size()) {
            throw new IncompatibleReportsException("Cannot diff reports of " + before.size()
                    + " and " + after.size() + " constraints");
        }
        for (int i = 0; i < before.size(); i++) {
            String beforeType = before.get(i).getType();
            String afterType = after.get(i).getType();
            if (!beforeType.equals(afterType)) {
                throw new IncompatibleReportsException("Constraint #" + i + " is " + beforeType
                        + " before and " + afterType + " after");
            }
        }
    }
}
