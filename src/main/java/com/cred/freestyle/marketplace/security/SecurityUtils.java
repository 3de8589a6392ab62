package com.cred.freestyle.marketplace.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Helpers for reading the caller's identity from the security context.
 *
 * @author Marketplace Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID, or null for anonymous requests
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }

        Object principal = authentication.getPrincipal();
        if (principal instanceof String) {
            return (String) principal;
        }
        return null;
    }

    /**
     * Get the currently authenticated user ID, failing if there is none.
     *
     * @return User ID
     * @throws AccessDeniedException if the request is not authenticated
     */
    public static String requireCurrentUserId() {
        String userId = getCurrentUserId();
        if (userId == null) {
            throw new AccessDeniedException("User not authenticated");
        }
        return userId;
    }

    /**
     * Check if the current user has a specific role.
     *
     * @param role Role to check (with or without ROLE_ prefix)
     * @return true if the user has the role
     */
    public static boolean hasRole(String role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }

        String roleWithPrefix = role.startsWith("ROLE_") ? role : "ROLE_" + role;
        return authentication.getAuthorities().stream()
                .anyMatch(authority -> authority.getAuthority().equals(roleWithPrefix));
    }

    public static boolean isAdmin() {
        return hasRole("ADMIN");
    }
}
