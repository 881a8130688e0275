package com.example.groupmix.compliance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.example.groupmix.compliance.detail.AttributeBalanceDetail;
import com.example.groupmix.compliance.detail.ImmovableDetail;
import com.example.groupmix.compliance.detail.NotTogetherDetail;
import com.example.groupmix.compliance.detail.PairMeetingCountSummaryDetail;
import com.example.groupmix.compliance.detail.PairMeetingSessionDetail;
import com.example.groupmix.compliance.detail.PersonPair;
import com.example.groupmix.compliance.detail.PersonPlacement;
import com.example.groupmix.compliance.detail.RepeatEncounterDetail;
import com.example.groupmix.compliance.detail.TogetherSplitDetail;
import com.example.groupmix.compliance.detail.ViolationDetail;
import com.example.groupmix.domain.Person;
import com.example.groupmix.domain.Problem;
import com.example.groupmix.domain.constraint.AttributeBalanceConstraint;
import com.example.groupmix.domain.constraint.ImmovablePeopleConstraint;
import com.example.groupmix.domain.constraint.PairMeetingCountConstraint;
import com.example.groupmix.domain.constraint.PeopleSetConstraint;
import com.example.groupmix.domain.constraint.RepeatEncounterConstraint;
import com.example.groupmix.domain.constraint.ShouldNotBeTogetherConstraint;

/**
 * Evaluates single constraints of a problem against one indexed schedule.
 * Every method is side-effect free; the evaluator only reads the problem and the index.
 */
public class ConstraintEvaluator {

    /** Bucket for people without the balanced attribute, or not defined in the problem. */
    public static final String UNKNOWN_ATTRIBUTE_VALUE = "__UNKNOWN__";

    private static final Comparator<PersonPair> PAIR_ORDER =
            Comparator.comparing(PersonPair::getFirst).thenComparing(PersonPair::getSecond);

    private final Problem problem;

    private final ScheduleIndex index;

    public ConstraintEvaluator(Problem problem, ScheduleIndex index) {
        this.problem = problem;
        this.index = index;
    }

    public ComplianceResult repeatEncounter(int constraintIndex, RepeatEncounterConstraint constraint) {
        Map<PersonPair, TreeSet<Integer>> sessionsByPair = new TreeMap<>(PAIR_ORDER);
        Map<PersonPair, Integer> countByPair = new HashMap<>();

        for (int session : index.getScheduledSessions()) {
            for (List<String> members : index.groupsIn(session).values()) {
                for (int i = 0; i < members.size(); i++) {
                    for (int j = i + 1; j < members.size(); j++) {
                        if (members.get(i).equals(members.get(j))) continue;
                        PersonPair pair = PersonPair.sorted(members.get(i), members.get(j));
                        countByPair.merge(pair, 1, Integer::sum);
                        sessionsByPair.computeIfAbsent(pair, p -> new TreeSet<>()).add(session);
                    }
                }
            }
        }

        int max = constraint.getMaxAllowedEncounters();
        int violations = 0;
        List<ViolationDetail> details = new ArrayList<>();
        for (Map.Entry<PersonPair, TreeSet<Integer>> entry : sessionsByPair.entrySet()) {
            int count = countByPair.get(entry.getKey());
            if (count > max) {
                violations += count - max;
                details.add(new RepeatEncounterDetail(entry.getKey(), count, max, new ArrayList<>(entry.getValue())));
            }
        }
        return new ComplianceResult(constraintIndex, constraint, violations, details);
    }

    public ComplianceResult attributeBalance(int constraintIndex, AttributeBalanceConstraint constraint) {
        int violations = 0;
        List<ViolationDetail> details = new ArrayList<>();

        for (int session : constraint.selectSessions(problem.getNumSessions())) {
            Map<String, Integer> counts = new HashMap<>();
            for (String personId : index.membersOf(session, constraint.getGroupId())) {
                Person person = problem.findPerson(personId);
                String value = person == null ? null : person.getAttribute(constraint.getAttributeKey());
                counts.merge(value == null ? UNKNOWN_ATTRIBUTE_VALUE : value, 1, Integer::sum);
            }

            for (Map.Entry<String, Integer> desired : constraint.getDesiredValues().entrySet()) {
                int actual = counts.getOrDefault(desired.getKey(), 0);
                int deficit = constraint.getMode().deficit(desired.getValue(), actual);
                if (deficit > 0) {
                    violations += deficit;
                    details.add(new AttributeBalanceDetail(session, constraint.getGroupId(), desired.getKey(),
                            desired.getValue(), actual));
                }
            }
        }
        return new ComplianceResult(constraintIndex, constraint, violations, details);
    }

    public ComplianceResult immovable(int constraintIndex, ImmovablePeopleConstraint constraint) {
        String required = constraint.getGroupId();
        int violations = 0;
        List<ViolationDetail> details = new ArrayList<>();

        for (int session : constraint.selectSessions(problem.getNumSessions())) {
            List<String> members = index.membersOf(session, required);
            for (String personId : constraint.getPeople()) {
                if (!participates(personId, session) || members.contains(personId)) {
                    continue;
                }
                violations++;
                details.add(new ImmovableDetail(session, personId, required, index.groupOf(personId, session)));
            }
        }
        return new ComplianceResult(constraintIndex, constraint, violations, details);
    }

    /**
     * Shared by the hard and the soft stay-together constraints. Every unassigned member
     * costs one violation, and a set spread over k groups costs k - 1 more.
     */
    public ComplianceResult stayTogether(int constraintIndex, PeopleSetConstraint constraint) {
        int violations = 0;
        List<ViolationDetail> details = new ArrayList<>();

        for (int session : constraint.selectSessions(problem.getNumSessions())) {
            List<PersonPlacement> placements = new ArrayList<>();
            Set<String> groupsUsed = new LinkedHashSet<>();
            int unassigned = 0;
            for (String personId : constraint.getPeople()) {
                if (!participates(personId, session)) continue;
                String groupId = index.groupOf(personId, session);
                placements.add(new PersonPlacement(personId, groupId));
                if (groupId == null) {
                    unassigned++;
                } else {
                    groupsUsed.add(groupId);
                }
            }

            int split = Math.max(0, groupsUsed.size() - 1);
            if (split > 0 || unassigned > 0) {
                violations += split + unassigned;
                details.add(new TogetherSplitDetail(session, placements));
            }
        }
        return new ComplianceResult(constraintIndex, constraint, violations, details);
    }

    public ComplianceResult shouldNotBeTogether(int constraintIndex, ShouldNotBeTogetherConstraint constraint) {
        Set<String> people = constraint.getPeople();
        int violations = 0;
        List<ViolationDetail> details = new ArrayList<>();

        for (int session : constraint.selectSessions(problem.getNumSessions())) {
            for (Map.Entry<String, List<String>> group : index.groupsIn(session).entrySet()) {
                Set<String> involved = new LinkedHashSet<>();
                for (String personId : group.getValue()) {
                    if (people.contains(personId)) involved.add(personId);
                }
                if (involved.size() > 1) {
                    violations += involved.size() - 1;
                    details.add(new NotTogetherDetail(session, group.getKey(), new ArrayList<>(involved)));
                }
            }
        }
        return new ComplianceResult(constraintIndex, constraint, violations, details);
    }

    /**
     * Always reports the tally and one together/apart entry per selected session, even when
     * the target is met, so the meeting history can be shown next to the result.
     */
    public ComplianceResult pairMeetingCount(int constraintIndex, PairMeetingCountConstraint constraint) {
        String a = constraint.getFirstPerson();
        String b = constraint.getSecondPerson();
        PersonPair pair = new PersonPair(a, b);
        List<Integer> sessions = constraint.selectSessions(problem.getNumSessions());

        int together = 0;
        List<ViolationDetail> perSession = new ArrayList<>(sessions.size());
        for (int session : sessions) {
            String shared = null;
            for (Map.Entry<String, List<String>> group : index.groupsIn(session).entrySet()) {
                if (group.getValue().contains(a) && group.getValue().contains(b)) {
                    shared = group.getKey();
                    break;
                }
            }
            if (shared != null) {
                together++;
                perSession.add(PairMeetingSessionDetail.together(session, pair, shared));
            } else {
                perSession.add(PairMeetingSessionDetail.apart(session, pair));
            }
        }

        int deviation = constraint.getMode().deviation(constraint.getTargetMeetings(), together);
        List<ViolationDetail> details = new ArrayList<>(perSession.size() + 1);
        details.add(new PairMeetingCountSummaryDetail(pair, constraint.getTargetMeetings(), constraint.getMode(),
                together, sessions));
        details.addAll(perSession);
        return new ComplianceResult(constraintIndex, constraint, deviation, details);
    }

    // unknown people are treated as participating so they surface as violations
    private boolean participates(String personId, int session) {
        Person person = problem.findPerson(personId);
        return person == null || person.participatesIn(session);
    }
}
