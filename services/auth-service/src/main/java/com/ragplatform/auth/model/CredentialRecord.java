package com.ragplatform.auth.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * CredentialRecord - one registered account.
 *
 * <ul>
 *   <li>email: unique login identifier (primary key of the store)</li>
 *   <li>passwordHash: salted BCrypt hash, never the plaintext</li>
 *   <li>roles: non-empty role labels, kept in seeding order</li>
 * </ul>
 *
 * Immutable; the role set is copied on construction.
 */
public record CredentialRecord(String email, String passwordHash, Set<String> roles) {

    public CredentialRecord {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(passwordHash, "passwordHash");
        Objects.requireNonNull(roles, "roles");
        if (email.isBlank()) {
            throw new IllegalArgumentException("email must not be blank");
        }
        if (roles.isEmpty()) {
            throw new IllegalArgumentException("account " + email + " must have at least one role");
        }
        roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles));
    }

    @Override
    public String toString() {
        return "CredentialRecord[email=" + email + ", roles=" + roles + "]";
    }
}
