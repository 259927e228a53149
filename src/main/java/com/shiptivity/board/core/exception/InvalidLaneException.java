package com.shiptivity.board.core.exception;

/**
 * Domain exception thrown when a status value names none of the three lanes.
 */
public class InvalidLaneException extends RuntimeException {

    public static final String EXPLANATION =
            "Status can only be one of the following: [backlog | in-progress | complete].";

    private final String rejectedValue;

    public InvalidLaneException(String rejectedValue) {
        super("Invalid status provided.");
        this.rejectedValue = rejectedValue;
    }

    public String getRejectedValue() {
        return rejectedValue;
    }
}
