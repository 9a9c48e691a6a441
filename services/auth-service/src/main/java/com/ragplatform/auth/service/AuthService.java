package com.ragplatform.auth.service;

import com.ragplatform.auth.dto.TokenResponse;
import com.ragplatform.auth.exception.AuthenticationFailedException;
import com.ragplatform.auth.model.CredentialRecord;
import com.ragplatform.auth.repository.CredentialRepository;
import com.ragplatform.auth.security.JwtUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * AuthService - Credential verification and token issuance.
 *
 * Key Responsibilities:
 * - Look up the account by email through {@link CredentialRepository}
 * - Verify the password against the stored BCrypt hash
 * - Issue a signed access token for the verified principal
 *
 * Enumeration Resistance:
 * - Unknown email and wrong password raise the same AuthenticationFailedException
 * - An unknown email still pays for one BCrypt comparison (against a throwaway
 *   hash), so both failure paths take about the same time
 *
 * The service holds no mutable state and is safe to call concurrently.
 *
 * @see JwtUtil for token operations
 * @see CredentialRepository for account lookup
 */
@Slf4j
@Service
public class AuthService {

    private final CredentialRepository credentialRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtil jwtUtil;

    /** Compared against when the email is unknown; matches nothing a caller can send. */
    private final String unknownAccountHash;

    public AuthService(CredentialRepository credentialRepository, PasswordEncoder passwordEncoder, JwtUtil jwtUtil) {
        this.credentialRepository = credentialRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtUtil = jwtUtil;
        this.unknownAccountHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Verify an email/password pair.
     *
     * @param email    login identifier
     * @param password plaintext password
     * @return the matching account
     * @throws AuthenticationFailedException if the email is unknown or the password is wrong
     */
    public CredentialRecord authenticate(String email, String password) {
        Optional<CredentialRecord> account = credentialRepository.findByEmail(email);
        String hash = account.map(CredentialRecord::passwordHash).orElse(unknownAccountHash);
        boolean matches = password != null && !password.isEmpty() && passwordEncoder.matches(password, hash);

        if (account.isEmpty() || !matches) {
            log.warn("Authentication failed for {}", email);
            throw new AuthenticationFailedException();
        }
        return account.get();
    }

    /**
     * Authenticate and issue a bearer token with the configured lifetime.
     *
     * @param email    login identifier
     * @param password plaintext password
     * @return token response ({@code access_token}, {@code token_type=bearer})
     * @throws AuthenticationFailedException on bad credentials
     */
    public TokenResponse login(String email, String password) {
        log.info("Login attempt for {}", email);
        CredentialRecord account = authenticate(email, password);

        String token = jwtUtil.generateToken(account.email(), account.roles());
        log.info("Issued access token for {} with roles {}", account.email(), account.roles());
        return TokenResponse.bearer(token);
    }
}
