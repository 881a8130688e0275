package com.example.groupmix.domain.constraint;

import java.util.Set;

public class ShouldStayTogetherConstraint extends PeopleSetConstraint {

    private final double penaltyWeight;

    public ShouldStayTogetherConstraint(Set<String> people, Set<Integer> sessions) {
        this(people, sessions, DEFAULT_PENALTY_WEIGHT);
    }

    public ShouldStayTogetherConstraint(Set<String> people, Set<Integer> sessions, double penaltyWeight) {
        super(people, sessions);
        this.penaltyWeight = checkWeight(penaltyWeight);
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.SHOULD_STAY_TOGETHER;
    }

    @Override
    public double getPenaltyWeight() {
        return penaltyWeight;
    }
}
