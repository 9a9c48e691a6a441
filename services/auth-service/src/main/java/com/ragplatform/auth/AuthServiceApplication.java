package com.ragplatform.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * AuthServiceApplication - Main entry point for the authentication service (auth-svc).
 *
 * This service is the identity component of the RAG platform, responsible for:
 * - Verifying email/password credentials against the account table
 * - Issuing short-lived, HMAC-signed JWT access tokens
 * - Validating bearer tokens presented to protected endpoints
 * - Gating operations by role membership
 *
 * Runtime:
 * - Listens on port 8101 unless PORT is set
 * - Stateless: no HTTP session, all identity state travels in the token
 * - Refuses to start without a JWT signing secret (JWT_SECRET)
 *
 * Spring Boot's default in-memory user is disabled; accounts come from
 * {@link com.ragplatform.auth.repository.CredentialRepository}.
 *
 * @see com.ragplatform.auth.controller.AuthController for REST endpoint definitions
 * @see com.ragplatform.auth.service.AuthService for credential checks
 * @see com.ragplatform.auth.security.JwtUtil for JWT token operations
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
