package com.example.groupmix.domain.constraint;

import java.util.Objects;

/**
 * Placeholder for a constraint type this version cannot evaluate, for example one
 * written by a newer editor. It is reported as satisfied and flagged as assumed.
 */
public class UnrecognizedConstraint extends Constraint {

    private final String typeName;

    public UnrecognizedConstraint(String typeName) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.UNRECOGNIZED;
    }

    @Override
    public String getTypeName() {
        return typeName;
    }
}
