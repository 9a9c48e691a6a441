package com.ragplatform.auth.security;

import com.ragplatform.auth.exception.InsufficientRoleException;

import java.util.Set;

/**
 * Role gate called explicitly by protected handlers.
 *
 * <pre>
 * RoleGate.requireAnyRole(principal, Set.of("admin"));
 * </pre>
 *
 * Looks only at the roles embedded in the validated token; the credential
 * store is never consulted.
 */
public final class RoleGate {

    private RoleGate() {
    }

    /**
     * Pass the principal through if it holds at least one of {@code requiredRoles}.
     *
     * @param principal     principal established by token validation
     * @param requiredRoles roles any one of which grants access
     * @return {@code principal}, unchanged
     * @throws InsufficientRoleException if the role sets do not intersect
     */
    public static AuthenticatedPrincipal requireAnyRole(AuthenticatedPrincipal principal, Set<String> requiredRoles) {
        if (principal == null || !principal.hasAnyRole(requiredRoles)) {
            throw new InsufficientRoleException("Principal "
                    + (principal == null ? "<none>" : principal.email())
                    + " holds none of " + requiredRoles);
        }
        return principal;
    }
}
