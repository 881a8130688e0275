package com.example.groupmix.domain.constraint;

import java.util.Objects;
import java.util.Set;

/**
 * Pins people to one group in the selected sessions. Hard.
 */
public class ImmovablePeopleConstraint extends PeopleSetConstraint {

    private final String groupId;

    private final boolean singlePerson;

    public ImmovablePeopleConstraint(Set<String> people, String groupId, Set<Integer> sessions) {
        this(people, groupId, sessions, false);
    }

    private ImmovablePeopleConstraint(Set<String> people, String groupId, Set<Integer> sessions, boolean singlePerson) {
        super(people, sessions);
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.singlePerson = singlePerson;
    }

    /**
     * The older single-person form. Evaluated exactly like the multi-person one
     * but reported with its own type name.
     */
    public static ImmovablePeopleConstraint singlePerson(String personId, String groupId, Set<Integer> sessions) {
        return new ImmovablePeopleConstraint(Set.of(personId), groupId, sessions, true);
    }

    @Override
    public ConstraintKind getKind() {
        return singlePerson ? ConstraintKind.IMMOVABLE_PERSON : ConstraintKind.IMMOVABLE_PEOPLE;
    }

    public String getGroupId() {
        return groupId;
    }
}
