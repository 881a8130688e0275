package com.example.groupmix.domain.constraint;

import java.util.Set;

public class MustStayTogetherConstraint extends PeopleSetConstraint {

    public MustStayTogetherConstraint(Set<String> people, Set<Integer> sessions) {
        super(people, sessions);
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.MUST_STAY_TOGETHER;
    }
}
