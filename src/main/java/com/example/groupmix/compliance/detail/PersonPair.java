package com.example.groupmix.compliance.detail;

import java.util.Objects;

/**
 * Two person ids in the order they were given.
 */
public final class PersonPair {

    private final String first;

    private final String second;

    public PersonPair(String first, String second) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
    }

    public static PersonPair sorted(String a, String b) {
        return a.compareTo(b) <= 0 ? new PersonPair(a, b) : new PersonPair(b, a);
    }

    public String getFirst() {
        return first;
    }

    public String getSecond() {
        return second;
    }

    public PersonPair sorted() {
        return sorted(first, second);
    }

    public boolean contains(String personId) {
        return first.equals(personId) || second.equals(personId);
    }

    @Override
    public String toString() {
        return first + " & " + second;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PersonPair that = (PersonPair) o;
        return first.equals(that.first) && second.equals(that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }
}
