package com.example.groupmix.compliance.detail;

import java.util.List;
import java.util.Objects;

public class TogetherSplitDetail extends ViolationDetail {

    private final int session;

    private final List<PersonPlacement> people;

    public TogetherSplitDetail(int session, List<PersonPlacement> people) {
        this.session = session;
        this.people = List.copyOf(people);
    }

    @Override
    public DetailKind getKind() {
        return DetailKind.TOGETHER_SPLIT;
    }

    public int getSession() {
        return session;
    }

    public List<PersonPlacement> getPeople() {
        return people;
    }

    @Override
    public String toString() {
        return "session " + session + " split: " + people;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TogetherSplitDetail that = (TogetherSplitDetail) o;
        return session == that.session && people.equals(that.people);
    }

    @Override
    public int hashCode() {
        return Objects.hash(session, people);
    }
}
