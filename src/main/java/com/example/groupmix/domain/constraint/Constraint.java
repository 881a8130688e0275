package com.example.groupmix.domain.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A declared rule a schedule should satisfy. Hard constraints carry no tunable weight
 * and report a weight of 1.
 */
public abstract class Constraint {

    /** Weight the optimizer applies to soft constraints declared without one. */
    public static final double DEFAULT_PENALTY_WEIGHT = 1000.0;

    public abstract ConstraintKind getKind();

    /**
     * Type tag as it appears in problem definitions.
     */
    public String getTypeName() {
        return getKind().getTypeName();
    }

    public boolean isHard() {
        return getKind().isHard();
    }

    public double getPenaltyWeight() {
        return 1.0;
    }

    protected static double checkWeight(double penaltyWeight) {
        if (penaltyWeight < 0 || Double.isNaN(penaltyWeight)) {
            throw new IllegalArgumentException("Penalty weight must be a non-negative number, got " + penaltyWeight);
        }
        return penaltyWeight;
    }

    protected static Set<Integer> copySessions(Set<Integer> sessions) {
        if (sessions == null || sessions.isEmpty()) {
            return null;
        }
        for (Integer session : sessions) {
            if (session == null || session < 0) {
                throw new IllegalArgumentException("Session indices must be non-negative, got " + sessions);
            }
        }
        return Collections.unmodifiableSet(new TreeSet<>(sessions));
    }

    /**
     * Sessions a constraint applies to: the declared ones in ascending order, or every
     * session of the problem when none were declared.
     */
    protected static List<Integer> resolveSessions(Set<Integer> sessions, int numSessions) {
        if (sessions == null) {
            List<Integer> all = new ArrayList<>(numSessions);
            for (int s = 0; s < numSessions; s++) {
                all.add(s);
            }
            return all;
        }
        return new ArrayList<>(sessions);
    }

    @Override
    public String toString() {
        return getTypeName();
    }
}
