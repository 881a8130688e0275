package com.example.groupmix.domain.constraint;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Asks two people to share a group a target number of times over the selected sessions.
 */
public class PairMeetingCountConstraint extends Constraint {

    private final String firstPerson;

    private final String secondPerson;

    private final int targetMeetings;

    private final MeetingMode mode;

    private final Set<Integer> sessions;

    private final double penaltyWeight;

    public PairMeetingCountConstraint(List<String> people, int targetMeetings, MeetingMode mode, Set<Integer> sessions) {
        this(people, targetMeetings, mode, sessions, 1.0);
    }

    public PairMeetingCountConstraint(List<String> people, int targetMeetings, MeetingMode mode,
                                      Set<Integer> sessions, double penaltyWeight) {
        if (people == null || people.size() != 2) {
            throw new IllegalArgumentException("PairMeetingCount needs exactly two people, got " + people);
        }
        if (targetMeetings < 0) {
            throw new IllegalArgumentException("targetMeetings must not be negative: " + targetMeetings);
        }
        this.firstPerson = Objects.requireNonNull(people.get(0), "person id");
        this.secondPerson = Objects.requireNonNull(people.get(1), "person id");
        this.targetMeetings = targetMeetings;
        this.mode = mode == null ? MeetingMode.AT_LEAST : mode;
        this.sessions = copySessions(sessions);
        this.penaltyWeight = checkWeight(penaltyWeight);
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.PAIR_MEETING_COUNT;
    }

    public String getFirstPerson() {
        return firstPerson;
    }

    public String getSecondPerson() {
        return secondPerson;
    }

    public int getTargetMeetings() {
        return targetMeetings;
    }

    public MeetingMode getMode() {
        return mode;
    }

    public Set<Integer> getSessions() {
        return sessions;
    }

    public List<Integer> selectSessions(int numSessions) {
        return resolveSessions(sessions, numSessions);
    }

    @Override
    public double getPenaltyWeight() {
        return penaltyWeight;
    }

    @Override
    public String toString() {
        return getTypeName() + "(" + firstPerson + ", " + secondPerson + ", " + mode + " " + targetMeetings + ")";
    }
}
