package com.example.FinSolve.exception;

/**
 * The generation service timed out, failed, or returned nothing usable.
 */
public class GenerationUnavailableException extends RuntimeException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
