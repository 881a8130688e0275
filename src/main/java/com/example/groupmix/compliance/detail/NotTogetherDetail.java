package com.example.groupmix.compliance.detail;

import java.util.List;
import java.util.Objects;

public class NotTogetherDetail extends ViolationDetail {

    private final int session;

    private final String groupId;

    private final List<String> people;

    public NotTogetherDetail(int session, String groupId, List<String> people) {
        this.session = session;
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.people = List.copyOf(people);
    }

    @Override
    public DetailKind getKind() {
        return DetailKind.NOT_TOGETHER;
    }

    public int getSession() {
        return session;
    }

    public String getGroupId() {
        return groupId;
    }

    public List<String> getPeople() {
        return people;
    }

    @Override
    public String toString() {
        return "session " + session + ", " + groupId + " holds " + people;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NotTogetherDetail that = (NotTogetherDetail) o;
        return session == that.session && groupId.equals(that.groupId) && people.equals(that.people);
    }

    @Override
    public int hashCode() {
        return Objects.hash(session, groupId, people);
    }
}
