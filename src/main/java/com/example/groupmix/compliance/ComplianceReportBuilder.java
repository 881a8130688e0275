package com.example.groupmix.compliance;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.groupmix.config.EvaluationConfig;
import com.example.groupmix.domain.Problem;
import com.example.groupmix.domain.Schedule;
import com.example.groupmix.domain.constraint.AttributeBalanceConstraint;
import com.example.groupmix.domain.constraint.Constraint;
import com.example.groupmix.domain.constraint.ImmovablePeopleConstraint;
import com.example.groupmix.domain.constraint.PairMeetingCountConstraint;
import com.example.groupmix.domain.constraint.PeopleSetConstraint;
import com.example.groupmix.domain.constraint.RepeatEncounterConstraint;
import com.example.groupmix.domain.constraint.ShouldNotBeTogetherConstraint;

/**
 * Evaluates every constraint of a problem against a schedule and collects the results
 * in constraint-list order. Constraints are independent of each other, so they may be
 * evaluated in parallel when the configuration allows it.
 */
public class ComplianceReportBuilder {

    private static final Logger log = LoggerFactory.getLogger(ComplianceReportBuilder.class);

    private final EvaluationConfig config;

    public ComplianceReportBuilder() {
        this(EvaluationConfig.defaults());
    }

    public ComplianceReportBuilder(EvaluationConfig config) {
        this.config = config;
    }

    public ComplianceReport build(Problem problem, Schedule schedule) {
        long start = System.nanoTime();
        ScheduleIndex index = ScheduleIndex.build(schedule.getAssignments(), problem.getNumSessions());
        ConstraintEvaluator evaluator = new ConstraintEvaluator(problem, index);
        List<Constraint> constraints = problem.getConstraints();

        IntStream positions = IntStream.range(0, constraints.size());
        if (config.shouldRunInParallel(constraints.size())) {
            positions = positions.parallel();
        }
        List<ComplianceResult> results = positions
                .mapToObj(i -> evaluate(evaluator, i, constraints.get(i)))
                .collect(Collectors.toList());

        ComplianceReport report = new ComplianceReport(results);
        if (log.isDebugEnabled()) {
            log.debug("Evaluated {} constraints over {} assignments in {} ms, {} violations",
                    constraints.size(), schedule.getAssignments().size(),
                    (System.nanoTime() - start) / 1_000_000, report.getTotalViolations());
        }
        return report;
    }

    private ComplianceResult evaluate(ConstraintEvaluator evaluator, int position, Constraint constraint) {
        return switch (constraint.getKind()) {
            case REPEAT_ENCOUNTER -> evaluator.repeatEncounter(position, (RepeatEncounterConstraint) constraint);
            case ATTRIBUTE_BALANCE -> evaluator.attributeBalance(position, (AttributeBalanceConstraint) constraint);
            case IMMOVABLE_PERSON, IMMOVABLE_PEOPLE ->
                    evaluator.immovable(position, (ImmovablePeopleConstraint) constraint);
            case MUST_STAY_TOGETHER, SHOULD_STAY_TOGETHER ->
                    evaluator.stayTogether(position, (PeopleSetConstraint) constraint);
            case SHOULD_NOT_BE_TOGETHER ->
                    evaluator.shouldNotBeTogether(position, (ShouldNotBeTogetherConstraint) constraint);
            case PAIR_MEETING_COUNT -> evaluator.pairMeetingCount(position, (PairMeetingCountConstraint) constraint);
            case UNRECOGNIZED -> {
                log.warn("Constraint #{} has unrecognized type '{}', assuming it is satisfied",
                        position, constraint.getTypeName());
                yield ComplianceResult.assumedSatisfied(position, constraint);
            }
        };
    }
}
