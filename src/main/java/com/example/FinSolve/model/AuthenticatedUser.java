package com.example.FinSolve.model;

import java.util.Objects;

/**
 * Identity handed over by the identity provider; trusted as-is.
 */
public record AuthenticatedUser(String userId, Role role) {
    public AuthenticatedUser {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
    }
}
