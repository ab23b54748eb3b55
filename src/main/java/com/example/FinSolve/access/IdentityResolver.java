package com.example.FinSolve.access;

import com.example.FinSolve.model.AuthenticatedUser;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Seam to the identity provider. Credentials are verified upstream; the result is trusted.
 */
public interface IdentityResolver {

    /**
     * @throws com.example.FinSolve.exception.UnauthorizedException when no valid identity is present
     */
    AuthenticatedUser resolve(HttpServletRequest request);
}
