package com.example.groupmix.domain.constraint;

public enum MeetingMode {
    AT_LEAST,
    EXACT,
    AT_MOST;

    public int deviation(int target, int actual) {
        switch (this) {
            case AT_LEAST:
                return Math.max(0, target - actual);
            case EXACT:
                return Math.abs(target - actual);
            case AT_MOST:
                return Math.max(0, actual - target);
            default:
                throw new IllegalStateException("Unhandled meeting mode " + this);
        }
    }
}
