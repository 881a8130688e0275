package com.example.groupmix.domain.constraint;

public enum BalanceMode {

    /** Any deviation from the desired count is a violation. */
    EXACT,
    /** Only a shortfall against the desired count is a violation. */
    AT_LEAST;

    public int deficit(int desired, int actual) {
        if (this == AT_LEAST) {
            return Math.max(0, desired - actual);
        }
        return Math.abs(actual - desired);
    }
}
