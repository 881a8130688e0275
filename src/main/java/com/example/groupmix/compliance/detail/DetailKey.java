package com.example.groupmix.compliance.detail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Order-insensitive identity of a violation detail. Two details are the same finding
 * iff their keys are equal.
 */
public final class DetailKey {

    private final List<Object> parts;

    DetailKey(Object... parts) {
        this.parts = Collections.unmodifiableList(Arrays.asList(parts));
    }

    public List<Object> getParts() {
        return parts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return parts.equals(((DetailKey) o).parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    @Override
    public String toString() {
        return parts.stream()
                .map(p -> p == null ? "" : String.valueOf(p))
                .collect(Collectors.joining("|"));
    }
}
