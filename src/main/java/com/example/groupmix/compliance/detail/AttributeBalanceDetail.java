package com.example.groupmix.compliance.detail;

import java.util.Objects;

public class AttributeBalanceDetail extends ViolationDetail {

    private final int session;

    private final String groupId;

    private final String attributeValue;

    private final int desired;

    private final int actual;

    public AttributeBalanceDetail(int session, String groupId, String attributeValue, int desired, int actual) {
        this.session = session;
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.attributeValue = Objects.requireNonNull(attributeValue, "attributeValue");
        this.desired = desired;
        this.actual = actual;
    }

    @Override
    public DetailKind getKind() {
        return DetailKind.ATTRIBUTE_BALANCE;
    }

    public int getSession() {
        return session;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getAttributeValue() {
        return attributeValue;
    }

    public int getDesired() {
        return desired;
    }

    public int getActual() {
        return actual;
    }

    @Override
    public String toString() {
        return "session " + session + ", " + groupId + ": '" + attributeValue + "' wanted " + desired + ", got " + actual;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeBalanceDetail that = (AttributeBalanceDetail) o;
        return session == that.session && desired == that.desired && actual == that.actual
                && groupId.equals(that.groupId) && attributeValue.equals(that.attributeValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(session, groupId, attributeValue, desired, actual);
    }
}
