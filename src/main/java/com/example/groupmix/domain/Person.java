package com.example.groupmix.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

public class Person {

    private final String id;

    private final Map<String, String> attributes;

    // null means the person takes part in every session
    private final Set<Integer> allowedSessions;

    public Person(String id) {
        this(id, Map.of(), null);
    }

    public Person(String id, Map<String, String> attributes) {
        this(id, attributes, null);
    }

    public Person(String id, Map<String, String> attributes, Set<Integer> allowedSessions) {
        this.id = Objects.requireNonNull(id, "id");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.allowedSessions = allowedSessions == null ? null : Collections.unmodifiableSet(new TreeSet<>(allowedSessions));
    }

    public String getId() {
        return id;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public Set<Integer> getAllowedSessions() {
        return allowedSessions;
    }

    public boolean participatesIn(int session) {
        return allowedSessions == null || allowedSessions.contains(session);
    }

    @Override
    public String toString() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Person person = (Person) o;
        return Objects.equals(id, person.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
