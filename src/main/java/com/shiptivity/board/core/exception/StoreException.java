package com.shiptivity.board.core.exception;

/**
 * Domain exception thrown when the record store fails to read or write clients.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
