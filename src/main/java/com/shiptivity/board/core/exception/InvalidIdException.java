package com.shiptivity.board.core.exception;

/**
 * Domain exception thrown when a client id is malformed or names no client.
 */
public class InvalidIdException extends RuntimeException {

    public enum Reason {
        NOT_AN_INTEGER("Id can only be integer."),
        NOT_FOUND("Cannot find client with that id.");

        private final String explanation;

        Reason(String explanation) {
            this.explanation = explanation;
        }

        public String getExplanation() {
            return explanation;
        }
    }

    private final Reason reason;

    public InvalidIdException(Reason reason) {
        super("Invalid id provided.");
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
