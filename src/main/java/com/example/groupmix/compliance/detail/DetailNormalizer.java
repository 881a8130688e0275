package com.example.groupmix.compliance.detail;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the identity key of a violation detail. Pairs and person lists are sorted so
 * the key does not depend on assignment order, and values that a diff compares
 * (encounter counts, actual attribute counts, meeting tallies) are left out so a changed
 * count is seen as the same finding rather than an add plus a remove.
 *
 * <p>Used both for de-duplicating the details of one result and for diffing two reports.
 */
public final class DetailNormalizer {

    private DetailNormalizer() {
    }

    public static DetailKey keyOf(ViolationDetail detail) {
        DetailKind kind = detail.getKind();
        return switch (kind) {
            case REPEAT_ENCOUNTER -> repeatEncounterKey((RepeatEncounterDetail) detail);
            case ATTRIBUTE_BALANCE -> attributeBalanceKey((AttributeBalanceDetail) detail);
            case IMMOVABLE -> immovableKey((ImmovableDetail) detail);
            case TOGETHER_SPLIT -> togetherSplitKey((TogetherSplitDetail) detail);
            case NOT_TOGETHER -> notTogetherKey((NotTogetherDetail) detail);
            case PAIR_MEETING_COUNT_SUMMARY -> pairMeetingSummaryKey((PairMeetingCountSummaryDetail) detail);
            case PAIR_MEETING_TOGETHER, PAIR_MEETING_APART -> pairMeetingSessionKey((PairMeetingSessionDetail) detail);
        };
    }

    private static DetailKey repeatEncounterKey(RepeatEncounterDetail d) {
        PersonPair pair = d.getPair().sorted();
        return new DetailKey(d.getKind().getTag(), pair.getFirst(), pair.getSecond());
    }

    private static DetailKey attributeBalanceKey(AttributeBalanceDetail d) {
        return new DetailKey(d.getKind().getTag(), d.getSession(), d.getGroupId(), d.getAttributeValue());
    }

    private static DetailKey immovableKey(ImmovableDetail d) {
        return new DetailKey(d.getKind().getTag(), d.getSession(), d.getPersonId(), d.getRequiredGroup(),
                d.getAssignedGroup());
    }

    private static DetailKey togetherSplitKey(TogetherSplitDetail d) {
        String people = d.getPeople().stream()
                .map(PersonPlacement::getPersonId)
                .sorted()
                .collect(Collectors.joining(","));
        return new DetailKey(d.getKind().getTag(), d.getSession(), people);
    }

    private static DetailKey notTogetherKey(NotTogetherDetail d) {
        String people = d.getPeople().stream().sorted().collect(Collectors.joining(","));
        return new DetailKey(d.getKind().getTag(), d.getSession(), d.getGroupId(), people);
    }

    private static DetailKey pairMeetingSummaryKey(PairMeetingCountSummaryDetail d) {
        PersonPair pair = d.getPair().sorted();
        return new DetailKey(d.getKind().getTag(), pair.getFirst(), pair.getSecond(), d.getMode(), d.getTarget());
    }

    // a flip between Together and Apart, or a move to another shared group, is an add plus a remove
    private static DetailKey pairMeetingSessionKey(PairMeetingSessionDetail d) {
        PersonPair pair = d.getPair().sorted();
        return new DetailKey(d.getKind().getTag(), d.getSession(), pair.getFirst(), pair.getSecond(),
                d.getGroupId());
    }

    /**
     * Keeps the first detail of every key, in encounter order.
     */
    public static List<ViolationDetail> distinct(List<? extends ViolationDetail> details) {
        return new ArrayList<>(index(details).values());
    }

    /**
     * Indexes details by key, keeping the first of duplicates.
     */
    public static Map<DetailKey, ViolationDetail> index(List<? extends ViolationDetail> details) {
        Map<DetailKey, ViolationDetail> byKey = new LinkedHashMap<>();
        for (ViolationDetail detail : details) {
            byKey.putIfAbsent(keyOf(detail), detail);
        }
        return byKey;
    }
}
