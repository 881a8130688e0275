package com.example.groupmix.domain.constraint;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base for constraints over a set of people, optionally limited to some sessions.
 */
public abstract class PeopleSetConstraint extends Constraint {

    private final Set<String> people;

    private final Set<Integer> sessions;

    protected PeopleSetConstraint(Set<String> people, Set<Integer> sessions) {
        Objects.requireNonNull(people, "people");
        people.forEach(p -> Objects.requireNonNull(p, "person id"));
        this.people = Collections.unmodifiableSet(new LinkedHashSet<>(people));
        this.sessions = copySessions(sessions);
    }

    public Set<String> getPeople() {
        return people;
    }

    /**
     * @return the declared sessions, or null when the constraint applies to all of them
     */
    public Set<Integer> getSessions() {
        return sessions;
    }

    public List<Integer> selectSessions(int numSessions) {
        return resolveSessions(sessions, numSessions);
    }

    @Override
    public String toString() {
        return getTypeName() + people;
    }
}
