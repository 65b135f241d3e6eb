package com.rcmp.marketplace.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Helpers for reading the caller's identity and checking account ownership.
 *
 * @author Marketplace Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated account ID.
     *
     * @return Account ID, or null if not authenticated
     */
    public static String getCurrentAccountId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()) {
            Object principal = authentication.getPrincipal();
            if (principal instanceof String) {
                return (String) principal;
            }
        }

        return null;
    }

    /**
     * Check if the current caller has a role.
     *
     * @param role Role without ROLE_ prefix
     * @return true if granted
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

    /**
     * Verify that the caller is the given account (or an admin).
     *
     * @param accountId Account the operation acts on
     * @throws AccessDeniedException if access is denied
     */
    public static void verifyAccountAccess(String accountId) {
        String currentAccountId = getCurrentAccountId();

        if (currentAccountId == null) {
            throw new AccessDeniedException("User not authenticated");
        }

        if (hasRole("ADMIN")) {
            return;
        }

        if (!currentAccountId.equals(accountId)) {
            throw new AccessDeniedException(
                "Access denied: account " + currentAccountId + " cannot act for account " + accountId
            );
        }
    }
}
