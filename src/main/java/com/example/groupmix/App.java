package com.example.groupmix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import ai.timefold.solver.core.api.score.buildin.hardsoftbigdecimal.HardSoftBigDecimalScore;

import com.example.groupmix.change.ChangeDiffEngine;
import com.example.groupmix.change.ChangeReport;
import com.example.groupmix.change.ChangeReportPrinter;
import com.example.groupmix.compliance.ComplianceReport;
import com.example.groupmix.compliance.ComplianceReportBuilder;
import com.example.groupmix.compliance.ScheduleIndex;
import com.example.groupmix.config.EvaluationConfigFactory;
import com.example.groupmix.domain.Assignment;
import com.example.groupmix.domain.Group;
import com.example.groupmix.domain.Person;
import com.example.groupmix.domain.Problem;
import com.example.groupmix.domain.Schedule;
import com.example.groupmix.domain.constraint.AttributeBalanceConstraint;
import com.example.groupmix.domain.constraint.BalanceMode;
import com.example.groupmix.domain.constraint.Constraint;
import com.example.groupmix.domain.constraint.ImmovablePeopleConstraint;
import com.example.groupmix.domain.constraint.MeetingMode;
import com.example.groupmix.domain.constraint.MustStayTogetherConstraint;
import com.example.groupmix.domain.constraint.PairMeetingCountConstraint;
import com.example.groupmix.domain.constraint.PenaltyFunction;
import com.example.groupmix.domain.constraint.RepeatEncounterConstraint;
import com.example.groupmix.domain.constraint.ShouldNotBeTogetherConstraint;
import com.example.groupmix.domain.constraint.ShouldStayTogetherConstraint;

/**
 * Demo: evaluates a sample schedule, proposes swapping two people and prints
 * what the swap would do to every constraint.
 */
public class App {

    public static void main(String[] args) {
        Problem problem = generateSampleProblem();
        Schedule schedule = roundRobinSchedule(problem);

        ComplianceReportBuilder builder = new ComplianceReportBuilder(EvaluationConfigFactory.createConfig());
        ChangeReportPrinter printer = new ChangeReportPrinter(System.out);

        prettyPrintInput(problem, schedule);
        ComplianceReport before = builder.build(problem, schedule);
        printer.printCompliance(before);

        // Move proposal: swap the first two people of different groups in session 0
        Assignment first = schedule.getAssignments().get(0);
        Assignment other = schedule.getAssignments().stream()
                .filter(a -> a.getSessionId() == 0 && !a.getGroupId().equals(first.getGroupId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Session 0 uses a single group"));
        System.out.println("Proposal: swap " + first.getPersonId() + " (" + first.getGroupId() + ") and "
                + other.getPersonId() + " (" + other.getGroupId() + ") in session 0\n");

        Schedule candidate = schedule.withSwap(0, first.getPersonId(), other.getPersonId());
        ComplianceReport after = builder.build(problem, candidate);
        ChangeReport change = new ChangeDiffEngine().diff(before, after);
        printer.printChange(change);

        System.out.println(change.getScoreDelta().compareTo(HardSoftBigDecimalScore.ZERO) >= 0
                ? "Verdict: accept" : "Verdict: reject");
    }

    private static Problem generateSampleProblem() {
        int peopleCount = 12;
        int groupCount = 3;
        int sessions = 4;
        String[] genders = {"female", "male"};
        String[] departments = {"engineering", "design", "sales"};

        Random random = new Random(123);

        List<Person> people = new ArrayList<>(peopleCount);
        for (int i = 0; i < peopleCount; i++) {
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("gender", genders[i % genders.length]);
            attributes.put("department", departments[random.nextInt(departments.length)]);
            // The last person only joins the first two sessions
            Set<Integer> allowed = i == peopleCount - 1 ? Set.of(0, 1) : null;
            people.add(new Person("P" + (i + 1), attributes, allowed));
        }

        List<Group> groups = new ArrayList<>(groupCount);
        for (int g = 0; g < groupCount; g++) {
            groups.add(new Group("G" + (g + 1), peopleCount / groupCount));
        }

        List<Constraint> constraints = List.of(
                new RepeatEncounterConstraint(1, PenaltyFunction.SQUARED, 100),
                new AttributeBalanceConstraint("G1", "gender", Map.of("female", 2, "male", 2), null,
                        BalanceMode.EXACT, 50),
                ImmovablePeopleConstraint.singlePerson("P1", "G1", Set.of(0, 1)),
                new MustStayTogetherConstraint(Set.of("P2", "P5"), null),
                new ShouldStayTogetherConstraint(Set.of("P3", "P6"), Set.of(2, 3), 10),
                new ShouldNotBeTogetherConstraint(Set.of("P4", "P7", "P10"), null, 20),
                new PairMeetingCountConstraint(List.of("P8", "P9"), 2, MeetingMode.AT_LEAST, null, 5));

        return new Problem(people, groups, sessions, constraints);
    }

    /**
     * Deals people into groups in a rotating order, one session at a time.
     */
    private static Schedule roundRobinSchedule(Problem problem) {
        List<Assignment> assignments = new ArrayList<>();
        List<Group> groups = problem.getGroups();
        List<Person> people = problem.getPeople();
        for (int session = 0; session < problem.getNumSessions(); session++) {
            int slot = 0;
            for (int i = 0; i < people.size(); i++) {
                Person person = people.get(i);
                if (!person.participatesIn(session)) continue;
                int groupIndex = (slot + session * (i % 2 + 1)) % groups.size();
                assignments.add(new Assignment(session, groups.get(groupIndex).getId(), person.getId()));
                slot++;
            }
        }
        return new Schedule(assignments);
    }

    private static void prettyPrintInput(Problem problem, Schedule schedule) {
        System.out.println("=== INPUT ===");
        System.out.println("People: " + problem.getPeople().size() + ", groups: " + problem.getGroups().size()
                + ", sessions: " + problem.getNumSessions() + ", constraints: " + problem.getConstraints().size());
        ScheduleIndex index = ScheduleIndex.build(schedule.getAssignments(), problem.getNumSessions());
        for (int session = 0; session < problem.getNumSessions(); session++) {
            System.out.println("Session " + session + ": " + index.groupsIn(session));
        }
        System.out.printf("Unique contacts: %d (avg %.1f per person)%n",
                index.countUniqueContacts(), index.averageUniqueContacts(problem.getPeople().size()));
        System.out.println("=== END INPUT ===\n");
    }
}
