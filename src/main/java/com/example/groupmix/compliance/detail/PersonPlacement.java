package com.example.groupmix.compliance.detail;

import java.util.Objects;

/**
 * A person and the group they sit in for one session, null when unassigned.
 */
public final class PersonPlacement {

    private final String personId;

    private final String groupId;

    public PersonPlacement(String personId, String groupId) {
        this.personId = Objects.requireNonNull(personId, "personId");
        this.groupId = groupId;
    }

    public String getPersonId() {
        return personId;
    }

    public String getGroupId() {
        return groupId;
    }

    @Override
    public String toString() {
        return personId + "@" + (groupId == null ? "unassigned" : groupId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PersonPlacement that = (PersonPlacement) o;
        return personId.equals(that.personId) && Objects.equals(groupId, that.groupId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(personId, groupId);
    }
}
