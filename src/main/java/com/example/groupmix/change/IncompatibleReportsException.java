package com.example.groupmix.change;

/**
 * Thrown when two compliance reports do not describe the same constraint list
 * and therefore cannot be diffed.
 */
public class IncompatibleReportsException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public IncompatibleReportsException(String message) {
        super(message);
    }
}
