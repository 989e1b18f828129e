package com.codeops.notebook.security;

import com.codeops.notebook.exception.AuthorizationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.UUID;

/**
 * Static accessors for the authenticated user of the current request.
 */
public final class SecurityUtils {

    private SecurityUtils() {}

    /**
     * Returns the authenticated user id.
     *
     * @return the current user id
     * @throws AuthorizationException if no user is authenticated
     */
    public static UUID getCurrentUserId() {
        UUID userId = getCurrentUserIdOrNull();
        if (userId == null) {
            throw new AuthorizationException("No authenticated user");
        }
        return userId;
    }

    /**
     * Returns the authenticated user id, or null when the session has no user.
     *
     * @return the current user id or null
     */
    public static UUID getCurrentUserIdOrNull() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof UUID userId)) {
            return null;
        }
        return userId;
    }
}
