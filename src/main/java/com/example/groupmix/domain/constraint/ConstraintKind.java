package com.example.groupmix.domain.constraint;

/**
 * Closed set of constraint kinds the evaluator understands.
 * {@link #UNRECOGNIZED} stands for any type tag this version does not know.
 */
public enum ConstraintKind {

    REPEAT_ENCOUNTER("RepeatEncounter", "Repeat Encounter", false),
    ATTRIBUTE_BALANCE("AttributeBalance", "Attribute Balance", false),
    IMMOVABLE_PERSON("ImmovablePerson", "Immovable Person", true),
    IMMOVABLE_PEOPLE("ImmovablePeople", "Immovable People", true),
    MUST_STAY_TOGETHER("MustStayTogether", "Must Stay Together", true),
    SHOULD_STAY_TOGETHER("ShouldStayTogether", "Should Stay Together", false),
    SHOULD_NOT_BE_TOGETHER("ShouldNotBeTogether", "Should Not Be Together", false),
    PAIR_MEETING_COUNT("PairMeetingCount", "Pair Meeting Count", false),
    UNRECOGNIZED("Unrecognized", "Unrecognized", false);

    private final String typeName;
    private final String label;
    private final boolean hard;

    ConstraintKind(String typeName, String label, boolean hard) {
        this.typeName = typeName;
        this.label = label;
        this.hard = hard;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getLabel() {
        return label;
    }

    public boolean isHard() {
        return hard;
    }

    public static ConstraintKind fromTypeName(String typeName) {
        for (ConstraintKind kind : values()) {
            if (kind != UNRECOGNIZED && kind.typeName.equals(typeName)) {
                return kind;
            }
        }
        return UNRECOGNIZED;
    }
}
