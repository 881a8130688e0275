package com.example.groupmix.domain;

import java.util.Objects;

/**
 * A group people are placed into in every session.
 * Capacity is informational here; the optimizer is expected to respect it.
 */
public class Group {

    private final String id;

    private final int capacity;

    public Group(String id, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Group " + id + " must have a positive capacity, got " + capacity);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.capacity = capacity;
    }

    public String getId() {
        return id;
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Group group = (Group) o;
        return Objects.equals(id, group.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
