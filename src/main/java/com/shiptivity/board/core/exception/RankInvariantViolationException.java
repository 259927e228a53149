package com.shiptivity.board.core.exception;

/**
 * Thrown when ranking input breaks the engine's contract or a computed board is not densely ranked.
 * Indicates a programming error rather than bad client input.
 */
public class RankInvariantViolationException extends RuntimeException {

    public RankInvariantViolationException(String message) {
        super(message);
    }
}
