package com.example.FinSolve.access;

import com.example.FinSolve.exception.UnauthorizedException;
import com.example.FinSolve.model.AuthenticatedUser;
import com.example.FinSolve.model.Role;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the identity the authenticating gateway forwards in request headers.
 */
@Component
public class HeaderIdentityResolver implements IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(HeaderIdentityResolver.class);

    public static final String USER_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    @Override
    public AuthenticatedUser resolve(HttpServletRequest request) {
        String userId = request.getHeader(USER_HEADER);
        String roleLabel = request.getHeader(ROLE_HEADER);
        if (userId == null || userId.isBlank() || roleLabel == null || roleLabel.isBlank()) {
            throw new UnauthorizedException("Missing identity headers");
        }
        try {
            return new AuthenticatedUser(userId.trim(), Role.fromLabel(roleLabel));
        } catch (IllegalArgumentException ex) {
            log.warn("Rejected identity for user={}: {}", userId, ex.getMessage());
            throw new UnauthorizedException("Invalid role");
        }
    }
}
