package com.example.groupmix.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The assignment records of one candidate solution. Final solutions and
 * intermediate snapshots from the optimizer share this shape.
 */
public class Schedule {

    private final List<Assignment> assignments;

    public Schedule(List<Assignment> assignments) {
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    /**
     * Returns a new schedule where the two people trade groups in the given session.
     * Records of other sessions are copied as they are.
     */
    public Schedule withSwap(int session, String personA, String personB) {
        String groupA = null;
        String groupB = null;
        for (Assignment a : assignments) {
            if (a.getSessionId() != session) continue;
            if (a.getPersonId().equals(personA)) groupA = a.getGroupId();
            if (a.getPersonId().equals(personB)) groupB = a.getGroupId();
        }
        if (groupA == null || groupB == null) {
            throw new IllegalArgumentException("Both " + personA + " and " + personB
                    + " must be assigned in session " + session + " to swap them");
        }
        List<Assignment> swapped = new ArrayList<>(assignments.size());
        for (Assignment a : assignments) {
            if (a.getSessionId() == session && a.getPersonId().equals(personA)) {
                swapped.add(new Assignment(session, groupB, personA));
            } else if (a.getSessionId() == session && a.getPersonId().equals(personB)) {
                swapped.add(new Assignment(session, groupA, personB));
            } else {
                swapped.add(a);
            }
        }
        return new Schedule(swapped);
    }

    @Override
    public String toString() {
        return "Schedule{" + assignments.size() + " assignments}";
    }
}
