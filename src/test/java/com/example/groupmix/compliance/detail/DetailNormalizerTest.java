package com.example.groupmix.compliance.detail;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.groupmix.domain.constraint.MeetingMode;

import static org.junit.jupiter.api.Assertions.*;

class DetailNormalizerTest {

    @Test
    void repeatEncounterKeyIgnoresPairOrderAndCount() {
        DetailKey a = new RepeatEncounterDetail(new PersonPair("B", "A"), 2, 1, List.of(0, 1)).key();
        DetailKey b = new RepeatEncounterDetail(new PersonPair("A", "B"), 3, 1, List.of(0, 1, 2)).key();

        assertEquals(a, b);
        assertEquals("RepeatEncounter|A|B", a.toString());
    }

    @Test
    void attributeBalanceKeyIgnoresActualCount() {
        DetailKey a = new AttributeBalanceDetail(0, "G1", "male", 2, 3).key();
        DetailKey b = new AttributeBalanceDetail(0, "G1", "male", 2, 4).key();
        DetailKey otherSession = new AttributeBalanceDetail(1, "G1", "male", 2, 3).key();

        assertEquals(a, b);
        assertNotEquals(a, otherSession);
    }

    @Test
    void immovableKeyIncludesAssignedGroup() {
        DetailKey wrongGroup = new ImmovableDetail(0, "A", "G1", "G2").key();
        DetailKey otherWrongGroup = new ImmovableDetail(0, "A", "G1", "G3").key();
        DetailKey unassigned = new ImmovableDetail(0, "A", "G1", null).key();

        assertNotEquals(wrongGroup, otherWrongGroup);
        assertNotEquals(wrongGroup, unassigned);
        assertEquals(unassigned, new ImmovableDetail(0, "A", "G1", null).key());
    }

    @Test
    void personListsAreSortedBeforeKeying() {
        DetailKey split = new TogetherSplitDetail(2, List.of(
                new PersonPlacement("B", "G1"), new PersonPlacement("A", "G2"))).key();
        DetailKey sameSplit = new TogetherSplitDetail(2, List.of(
                new PersonPlacement("A", "G1"), new PersonPlacement("B", null))).key();
        assertEquals(split, sameSplit);

        DetailKey notTogether = new NotTogetherDetail(0, "G1", List.of("C", "A", "B")).key();
        assertEquals(new NotTogetherDetail(0, "G1", List.of("A", "B", "C")).key(), notTogether);
        assertNotEquals(new NotTogetherDetail(0, "G2", List.of("A", "B", "C")).key(), notTogether);
    }

    @Test
    void pairMeetingKeys() {
        PersonPair pair = new PersonPair("B", "A");
        DetailKey summary = new PairMeetingCountSummaryDetail(pair, 2, MeetingMode.AT_LEAST, 1, List.of(0, 1)).key();
        assertEquals(new PairMeetingCountSummaryDetail(new PersonPair("A", "B"), 2, MeetingMode.AT_LEAST, 2,
                List.of(0, 1)).key(), summary);
        assertNotEquals(new PairMeetingCountSummaryDetail(pair, 2, MeetingMode.EXACT, 1, List.of(0, 1)).key(),
                summary);

        DetailKey together = PairMeetingSessionDetail.together(0, pair, "G1").key();
        DetailKey apart = PairMeetingSessionDetail.apart(0, pair).key();
        assertNotEquals(together, apart);
        assertEquals(together, PairMeetingSessionDetail.together(0, new PersonPair("A", "B"), "G1").key());
        assertNotEquals(together, PairMeetingSessionDetail.together(0, pair, "G2").key());
        assertEquals(List.of("PairMeetingTogether", 0, "A", "B", "G1"), together.getParts());
        assertEquals("PairMeetingApart|0|A|B|", apart.toString());
    }

    @Test
    void distinctKeepsFirstOfEachKey() {
        RepeatEncounterDetail first = new RepeatEncounterDetail(new PersonPair("A", "B"), 2, 1, List.of(0, 1));
        RepeatEncounterDetail duplicate = new RepeatEncounterDetail(new PersonPair("B", "A"), 2, 1, List.of(0, 1));
        ImmovableDetail other = new ImmovableDetail(0, "A", "G1", null);

        List<ViolationDetail> distinct = DetailNormalizer.distinct(List.of(first, other, duplicate));

        assertEquals(2, distinct.size());
        assertSame(first, distinct.get(0));
        assertSame(other, distinct.get(1));
    }
}
