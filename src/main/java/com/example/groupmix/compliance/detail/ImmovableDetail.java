package com.example.groupmix.compliance.detail;

import java.util.Objects;

public class ImmovableDetail extends ViolationDetail {

    private final int session;

    private final String personId;

    private final String requiredGroup;

    // null when the person is not assigned in that session
    private final String assignedGroup;

    public ImmovableDetail(int session, String personId, String requiredGroup, String assignedGroup) {
        this.session = session;
        this.personId = Objects.requireNonNull(personId, "personId");
        this.requiredGroup = Objects.requireNonNull(requiredGroup, "requiredGroup");
        this.assignedGroup = assignedGroup;
    }

    @Override
    public DetailKind getKind() {
        return DetailKind.IMMOVABLE;
    }

    public int getSession() {
        return session;
    }

    public String getPersonId() {
        return personId;
    }

    public String getRequiredGroup() {
        return requiredGroup;
    }

    public String getAssignedGroup() {
        return assignedGroup;
    }

    public boolean isUnassigned() {
        return assignedGroup == null;
    }

    @Override
    public String toString() {
        return "session " + session + ": " + personId + " must be in " + requiredGroup
                + (assignedGroup == null ? " but is not assigned" : " but is in " + assignedGroup);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImmovableDetail that = (ImmovableDetail) o;
        return session == that.session && personId.equals(that.personId)
                && requiredGroup.equals(that.requiredGroup) && Objects.equals(assignedGroup, that.assignedGroup);
    }

    @Override
    public int hashCode() {
        return Objects.hash(session, personId, requiredGroup, assignedGroup);
    }
}
