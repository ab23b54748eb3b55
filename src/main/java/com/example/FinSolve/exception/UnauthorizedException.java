package com.example.FinSolve.exception;

/**
 * Missing or invalid caller identity. Raised before the query pipeline is reached.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
