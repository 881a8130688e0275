package com.example.groupmix.compliance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.example.groupmix.config.EvaluationConfig;
import com.example.groupmix.domain.Assignment;
import com.example.groupmix.domain.Group;
import com.example.groupmix.domain.Person;
import com.example.groupmix.domain.Problem;
import com.example.groupmix.domain.Schedule;
import com.example.groupmix.domain.constraint.AttributeBalanceConstraint;
import com.example.groupmix.domain.constraint.BalanceMode;
import com.example.groupmix.domain.constraint.Constraint;
import com.example.groupmix.domain.constraint.ConstraintKind;
import com.example.groupmix.domain.constraint.ImmovablePeopleConstraint;
import com.example.groupmix.domain.constraint.MeetingMode;
import com.example.groupmix.domain.constraint.MustStayTogetherConstraint;
import com.example.groupmix.domain.constraint.PairMeetingCountConstraint;
import com.example.groupmix.domain.constraint.PenaltyFunction;
import com.example.groupmix.domain.constraint.RepeatEncounterConstraint;
import com.example.groupmix.domain.constraint.ShouldNotBeTogetherConstraint;
import com.example.groupmix.domain.constraint.ShouldStayTogetherConstraint;
import com.example.groupmix.domain.constraint.UnrecognizedConstraint;

import static org.junit.jupiter.api.Assertions.*;

class ComplianceReportBuilderTest {

    private final ComplianceReportBuilder builder = new ComplianceReportBuilder();

    private static List<Person> people(int count) {
        List<Person> people = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            people.add(new Person("P" + i, Map.of("gender", i % 2 == 0 ? "female" : "male")));
        }
        return people;
    }

    private static List<Constraint> allKinds() {
        return List.of(
                new RepeatEncounterConstraint(1, PenaltyFunction.LINEAR, 10),
                new AttributeBalanceConstraint("G1", "gender", Map.of("female", 2, "male", 1), null,
                        BalanceMode.EXACT, 5),
                ImmovablePeopleConstraint.singlePerson("P0", "G1", Set.of(0, 2)),
                new ImmovablePeopleConstraint(Set.of("P1", "P2"), "G2", null),
                new MustStayTogetherConstraint(Set.of("P3", "P4"), null),
                new ShouldStayTogetherConstraint(Set.of("P5", "P6", "P7"), Set.of(1), 7),
                new ShouldNotBeTogetherConstraint(Set.of("P0", "P2", "P4", "P6"), null, 3),
                new PairMeetingCountConstraint(List.of("P1", "P8"), 2, MeetingMode.EXACT, null, 2));
    }

    private static Schedule randomSchedule(long seed, int people, int sessions) {
        Random random = new Random(seed);
        List<Assignment> assignments = new ArrayList<>();
        for (int s = 0; s < sessions; s++) {
            List<Integer> order = new ArrayList<>();
            for (int p = 0; p < people; p++) order.add(p);
            Collections.shuffle(order, random);
            for (int slot = 0; slot < order.size(); slot++) {
                assignments.add(new Assignment(s, "G" + (slot % 3 + 1), "P" + order.get(slot)));
            }
        }
        return new Schedule(assignments);
    }

    private static Problem problem(List<Constraint> constraints) {
        return new Problem(people(9), List.of(new Group("G1", 3), new Group("G2", 3), new Group("G3", 3)),
                3, constraints);
    }

    @Test
    void noConstraintsGivesEmptyReport() {
        ComplianceReport report = builder.build(problem(List.of()), randomSchedule(1, 9, 3));

        assertEquals(0, report.size());
        assertTrue(report.isFullyCompliant());
    }

    @Test
    void resultsFollowConstraintOrder() {
        List<Constraint> constraints = allKinds();
        ComplianceReport report = builder.build(problem(constraints), randomSchedule(7, 9, 3));

        assertEquals(constraints.size(), report.size());
        for (int i = 0; i < constraints.size(); i++) {
            ComplianceResult result = report.get(i);
            assertEquals(i, result.getConstraintIndex());
            assertSame(constraints.get(i), result.getConstraint());
            assertEquals(constraints.get(i).getTypeName(), result.getType());
        }
        assertEquals("ImmovablePerson", report.get(2).getType());
        assertEquals("ImmovablePeople", report.get(3).getType());
    }

    @Test
    void adheresExactlyWhenNoViolations() {
        for (long seed = 0; seed < 20; seed++) {
            ComplianceReport report = builder.build(problem(allKinds()), randomSchedule(seed, 9, 3));
            for (ComplianceResult result : report.getResults()) {
                assertEquals(result.getViolationsCount() == 0, result.adheres(), result.toString());
            }
        }
    }

    @Test
    void repeatEncounterIgnoresRecordOrder() {
        Problem problem = problem(List.of(new RepeatEncounterConstraint(0, PenaltyFunction.LINEAR, 1)));
        Schedule schedule = randomSchedule(3, 9, 3);
        List<Assignment> shuffled = new ArrayList<>(schedule.getAssignments());
        Collections.shuffle(shuffled, new Random(99));

        ComplianceResult original = builder.build(problem, schedule).get(0);
        ComplianceResult reordered = builder.build(problem, new Schedule(shuffled)).get(0);

        assertEquals(original.getViolationsCount(), reordered.getViolationsCount());
        assertEquals(original.getDetails(), reordered.getDetails());
    }

    @Test
    void evaluatingTwiceGivesEqualReports() {
        Problem problem = problem(allKinds());
        Schedule schedule = randomSchedule(11, 9, 3);

        assertEquals(builder.build(problem, schedule), builder.build(problem, schedule));
    }

    @Test
    void parallelEvaluationMatchesSequential() {
        List<Constraint> constraints = new ArrayList<>();
        for (int i = 0; i < 5; i++) constraints.addAll(allKinds());
        Problem problem = problem(constraints);
        Schedule schedule = randomSchedule(5, 9, 3);
        ComplianceReportBuilder parallel = new ComplianceReportBuilder(new EvaluationConfig(true, 2));

        assertEquals(builder.build(problem, schedule), parallel.build(problem, schedule));
    }

    @Test
    void unrecognizedConstraintIsAssumedSatisfied() {
        List<Constraint> constraints = new ArrayList<>(allKinds());
        constraints.add(1, new UnrecognizedConstraint("GroupSizeBalance"));

        ComplianceReport report = builder.build(problem(constraints), randomSchedule(2, 9, 3));

        ComplianceResult result = report.get(1);
        assertEquals(ConstraintKind.UNRECOGNIZED, result.getKind());
        assertEquals("GroupSizeBalance", result.getType());
        assertTrue(result.adheres());
        assertTrue(result.isAssumedSatisfied());
        assertTrue(result.getDetails().isEmpty());
        assertFalse(report.get(0).isAssumedSatisfied());
    }

    @Test
    void penaltyScoreSeparatesHardAndSoft() {
        Problem problem = new Problem(people(3), List.of(new Group("G1", 3), new Group("G2", 3)), 1, List.of(
                new RepeatEncounterConstraint(0, PenaltyFunction.LINEAR, 2.5),
                new MustStayTogetherConstraint(Set.of("P0", "P2"), null)));
        Schedule schedule = new Schedule(List.of(
                new Assignment(0, "G1", "P0"), new Assignment(0, "G1", "P1"), new Assignment(0, "G2", "P2")));

        ComplianceReport report = builder.build(problem, schedule);

        assertEquals(2, report.getTotalViolations());
        assertEquals(0, report.getPenaltyScore().hardScore().compareTo(BigDecimal.valueOf(-1)));
        assertEquals(0, report.getPenaltyScore().softScore().compareTo(new BigDecimal("-2.5")));
        assertFalse(report.getPenaltyScore().isFeasible());
        assertEquals(2.5, report.get(0).getWeightedViolations(), 1e-9);
        assertEquals(1.0, report.get(1).getWeightedViolations(), 1e-9);
    }

    @Test
    void reportsAreReadOnly() {
        ComplianceReport report = builder.build(problem(allKinds()), randomSchedule(4, 9, 3));

        assertThrows(UnsupportedOperationException.class, () -> report.getResults().remove(0));
        assertThrows(UnsupportedOperationException.class, () -> report.get(0).getDetails().clear());
    }
}
