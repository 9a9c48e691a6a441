package com.ragplatform.auth.repository;

import com.ragplatform.auth.model.CredentialRecord;

import java.util.Optional;

/**
 * CredentialRepository - lookup of accounts by login identifier.
 *
 * This is the only capability the identity logic needs from storage, so the
 * backing store (in-memory table, database, directory service) can change
 * without touching {@link com.ragplatform.auth.service.AuthService}.
 *
 * Implementations must be safe for concurrent reads.
 *
 * @see InMemoryCredentialRepository for the demo account table
 */
public interface CredentialRepository {

    /**
     * Find an account by its email address.
     *
     * @param email the identifier to look up (exact, case-sensitive match)
     * @return the account, or empty if none is registered under {@code email}
     */
    Optional<CredentialRecord> findByEmail(String email);
}
