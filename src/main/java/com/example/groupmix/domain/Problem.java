package com.example.groupmix.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.example.groupmix.domain.constraint.Constraint;

/**
 * A group-mixing problem: who is placed, into which groups, over how many sessions,
 * and under which constraints. The order of {@link #getConstraints()} is the identity
 * of each constraint in compliance and change reports.
 */
public class Problem {

    private final List<Person> people;

    private final List<Group> groups;

    private final int numSessions;

    private final List<Constraint> constraints;

    private final Map<String, Person> peopleById;

    public Problem(List<Person> people, List<Group> groups, int numSessions, List<Constraint> constraints) {
        if (numSessions < 0) {
            throw new IllegalArgumentException("Number of sessions must not be negative: " + numSessions);
        }
        this.people = Collections.unmodifiableList(new ArrayList<>(people));
        this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
        this.numSessions = numSessions;
        this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
        constraints.forEach(c -> Objects.requireNonNull(c, "constraint"));

        Map<String, Person> byId = new LinkedHashMap<>();
        for (Person person : this.people) {
            byId.put(person.getId(), person);
        }
        this.peopleById = Collections.unmodifiableMap(byId);
    }

    public List<Person> getPeople() {
        return people;
    }

    public List<Group> getGroups() {
        return groups;
    }

    public int getNumSessions() {
        return numSessions;
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    /**
     * @return the person with that id, or null when the problem does not define it
     */
    public Person findPerson(String personId) {
        return peopleById.get(personId);
    }

    /**
     * Returns a copy of this problem whose constraint at {@code index} is replaced.
     * Constraints are never reordered, so every other index keeps its identity.
     */
    public Problem withConstraint(int index, Constraint constraint) {
        List<Constraint> copy = new ArrayList<>(constraints);
        copy.set(index, constraint);
        return new Problem(people, groups, numSessions, copy);
    }
}
