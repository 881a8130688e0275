package com.example.groupmix.domain;

import java.util.Objects;

/**
 * One placement of a person into a group for a single session.
 */
public class Assignment {

    private final int sessionId;

    private final String groupId;

    private final String personId;

    public Assignment(int sessionId, String groupId, String personId) {
        if (sessionId < 0) {
            throw new IllegalArgumentException("Session index must not be negative: " + sessionId);
        }
        this.sessionId = sessionId;
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.personId = Objects.requireNonNull(personId, "personId");
    }

    public int getSessionId() {
        return sessionId;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getPersonId() {
        return personId;
    }

    @Override
    public String toString() {
        return "S" + sessionId + ":" + groupId + ":" + personId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Assignment that = (Assignment) o;
        return sessionId == that.sessionId
                && Objects.equals(groupId, that.groupId)
                && Objects.equals(personId, that.personId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, groupId, personId);
    }
}
