package com.example.groupmix.domain;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleTest {

    private final Schedule schedule = new Schedule(List.of(
            new Assignment(0, "G1", "A"),
            new Assignment(0, "G2", "B"),
            new Assignment(1, "G1", "A"),
            new Assignment(1, "G1", "B")));

    @Test
    void swapTradesGroupsWithinOneSession() {
        Schedule swapped = schedule.withSwap(0, "A", "B");

        assertEquals(List.of(
                new Assignment(0, "G2", "A"),
                new Assignment(0, "G1", "B"),
                new Assignment(1, "G1", "A"),
                new Assignment(1, "G1", "B")), swapped.getAssignments());
        // the original is untouched
        assertEquals("G1", schedule.getAssignments().get(0).getGroupId());
    }

    @Test
    void swapRequiresBothPeopleInTheSession() {
        assertThrows(IllegalArgumentException.class, () -> schedule.withSwap(0, "A", "Z"));
        assertThrows(IllegalArgumentException.class, () -> schedule.withSwap(2, "A", "B"));
    }

    @Test
    void assignmentsAreReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> schedule.getAssignments().add(new Assignment(0, "G1", "C")));
    }

    @Test
    void scoreSummaryDifferenceIsFieldWise() {
        ScoreSummary delta = new ScoreSummary(10.0, 5, 2, 0.5, 1).minus(new ScoreSummary(12.5, 4, 3, 0.5, 0));

        assertEquals(-2.5, delta.getFinalScore(), 1e-9);
        assertEquals(1, delta.getUniqueContacts());
        assertEquals(-1, delta.getRepetitionPenalty());
        assertEquals(0.0, delta.getAttributeBalancePenalty(), 1e-9);
        assertEquals(1, delta.getConstraintPenalty());
    }
}
