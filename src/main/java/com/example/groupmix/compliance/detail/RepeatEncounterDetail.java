package com.example.groupmix.compliance.detail;

import java.util.List;
import java.util.Objects;

public class RepeatEncounterDetail extends ViolationDetail {

    private final PersonPair pair;

    private final int count;

    private final int maxAllowed;

    private final List<Integer> sessions;

    public RepeatEncounterDetail(PersonPair pair, int count, int maxAllowed, List<Integer> sessions) {
        this.pair = Objects.requireNonNull(pair, "pair");
        this.count = count;
        this.maxAllowed = maxAllowed;
        this.sessions = List.copyOf(sessions);
    }

    @Override
    public DetailKind getKind() {
        return DetailKind.REPEAT_ENCOUNTER;
    }

    public PersonPair getPair() {
        return pair;
    }

    public int getCount() {
        return count;
    }

    public int getMaxAllowed() {
        return maxAllowed;
    }

    /**
     * Sessions in which the pair shared a group, ascending.
     */
    public List<Integer> getSessions() {
        return sessions;
    }

    @Override
    public String toString() {
        return pair + " met " + count + "x (max " + maxAllowed + ") in sessions " + sessions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RepeatEncounterDetail that = (RepeatEncounterDetail) o;
        return count == that.count && maxAllowed == that.maxAllowed
                && pair.equals(that.pair) && sessions.equals(that.sessions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pair, count, maxAllowed, sessions);
    }
}
