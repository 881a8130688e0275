package com.example.groupmix.compliance.detail;

public enum DetailKind {
    REPEAT_ENCOUNTER("RepeatEncounter"),
    ATTRIBUTE_BALANCE("AttributeBalance"),
    IMMOVABLE("Immovable"),
    TOGETHER_SPLIT("TogetherSplit"),
    NOT_TOGETHER("NotTogether"),
    PAIR_MEETING_COUNT_SUMMARY("PairMeetingCountSummary"),
    PAIR_MEETING_TOGETHER("PairMeetingTogether"),
    PAIR_MEETING_APART("PairMeetingApart");

    private final String tag;

    DetailKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
