package com.ragplatform.auth.security;

import java.security.Principal;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Identity established from a validated access token: the token subject and
 * the roles it was issued with. Built per request, never stored.
 *
 * <p>Implements {@link Principal} so {@code Authentication#getName()} returns
 * the email.</p>
 */
public record AuthenticatedPrincipal(String email, Set<String> roles) implements Principal {

    public AuthenticatedPrincipal {
        Objects.requireNonNull(email, "email");
        roles = roles == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(roles));
    }

    @Override
    public String getName() {
        return email;
    }

    public boolean hasAnyRole(Collection<String> candidates) {
        for (String candidate : candidates) {
            if (roles.contains(candidate)) {
                return true;
            }
        }
        return false;
    }
}
