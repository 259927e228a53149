package com.shiptivity.board.core.exception;

/**
 * Domain exception thrown when a priority is present but is not a positive integer.
 */
public class InvalidPriorityException extends RuntimeException {

    public static final String EXPLANATION = "Priority can only be positive integer.";

    private final String rejectedValue;

    public InvalidPriorityException(String rejectedValue) {
        super("Invalid priority provided.");
        this.rejectedValue = rejectedValue;
    }

    public String getRejectedValue() {
        return rejectedValue;
    }
}
