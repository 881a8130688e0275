package com.example.groupmix.compliance.detail;

import java.util.List;
import java.util.Objects;

import com.example.groupmix.domain.constraint.MeetingMode;

/**
 * Overall meeting tally of a pair. Emitted whether or not the target is met.
 */
public class PairMeetingCountSummaryDetail extends ViolationDetail {

    private final PersonPair pair;

    private final int target;

    private final MeetingMode mode;

    private final int actual;

    private final List<Integer> sessions;

    public PairMeetingCountSummaryDetail(PersonPair pair, int target, MeetingMode mode, int actual, List<Integer> sessions) {
        this.pair = Objects.requireNonNull(pair, "pair");
        this.target = target;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.actual = actual;
        this.sessions = List.copyOf(sessions);
    }

    @Override
    public DetailKind getKind() {
        return DetailKind.PAIR_MEETING_COUNT_SUMMARY;
    }

    public PersonPair getPair() {
        return pair;
    }

    public int getTarget() {
        return target;
    }

    public MeetingMode getMode() {
        return mode;
    }

    public int getActual() {
        return actual;
    }

    /**
     * Sessions the tally was taken over.
     */
    public List<Integer> getSessions() {
        return sessions;
    }

    public int getDeviation() {
        return mode.deviation(target, actual);
    }

    @Override
    public String toString() {
        return pair + " met " + actual + "x, " + mode + " " + target + " over sessions " + sessions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PairMeetingCountSummaryDetail that = (PairMeetingCountSummaryDetail) o;
        return target == that.target && actual == that.actual && mode == that.mode
                && pair.equals(that.pair) && sessions.equals(that.sessions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pair, target, mode, actual, sessions);
    }
}
