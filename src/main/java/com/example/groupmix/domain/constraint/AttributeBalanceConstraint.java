package com.example.groupmix.domain.constraint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Asks for a given number of people per attribute value inside one group.
 * Attribute values missing from {@code desiredValues} are not constrained.
 */
public class AttributeBalanceConstraint extends Constraint {

    private final String groupId;

    private final String attributeKey;

    private final Map<String, Integer> desiredValues;

    private final Set<Integer> sessions;

    private final BalanceMode mode;

    private final double penaltyWeight;

    public AttributeBalanceConstraint(String groupId, String attributeKey, Map<String, Integer> desiredValues,
                                      Set<Integer> sessions, BalanceMode mode, double penaltyWeight) {
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.attributeKey = Objects.requireNonNull(attributeKey, "attributeKey");
        desiredValues.forEach((value, count) -> {
            if (count == null || count < 0) {
                throw new IllegalArgumentException("Desired count for '" + value + "' must be non-negative, got " + count);
            }
        });
        this.desiredValues = Collections.unmodifiableMap(new LinkedHashMap<>(desiredValues));
        this.sessions = copySessions(sessions);
        this.mode = mode == null ? BalanceMode.EXACT : mode;
        this.penaltyWeight = checkWeight(penaltyWeight);
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.ATTRIBUTE_BALANCE;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getAttributeKey() {
        return attributeKey;
    }

    public Map<String, Integer> getDesiredValues() {
        return desiredValues;
    }

    public Set<Integer> getSessions() {
        return sessions;
    }

    public List<Integer> selectSessions(int numSessions) {
        return resolveSessions(sessions, numSessions);
    }

    public BalanceMode getMode() {
        return mode;
    }

    @Override
    public double getPenaltyWeight() {
        return penaltyWeight;
    }

    @Override
    public String toString() {
        return getTypeName() + "(" + groupId + ", " + attributeKey + "=" + desiredValues + ")";
    }
}
