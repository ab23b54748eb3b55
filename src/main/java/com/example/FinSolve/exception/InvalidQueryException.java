package com.example.FinSolve.exception;

/**
 * Malformed client input, e.g. a blank question.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
