package com.example.groupmix.compliance.detail;

/**
 * One localized finding produced while evaluating a constraint, such as an
 * over-limit pair or a mis-balanced group in one session.
 */
public abstract class ViolationDetail {

    public abstract DetailKind getKind();

    /**
     * Identity of this finding across reports, see {@link DetailNormalizer}.
     */
    public final DetailKey key() {
        return DetailNormalizer.keyOf(this);
    }
}
