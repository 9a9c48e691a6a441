package com.ragplatform.auth.security;

import com.ragplatform.auth.config.JwtProperties;
import com.ragplatform.auth.exception.InvalidTokenException;
import com.ragplatform.auth.exception.TokenFailureReason;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JwtUtil - Issues and validates the service's JSON Web Tokens.
 *
 * JWT Structure (RFC 7519):
 * - Header: Algorithm (HS256 by default) and token type
 * - Payload: sub (email), roles (array), iat, exp
 * - Signature: HMAC over header and payload with the configured secret
 *
 * Configuration comes from {@link JwtProperties}, passed in at construction;
 * the current time comes from the injected {@link Clock}. Both are fixed for
 * the lifetime of the instance, which makes it safe to share across threads.
 *
 * Token Lifecycle:
 * 1. Credentials verified by AuthService
 * 2. generateToken() signs subject + roles with an expiry
 * 3. Client sends the token in the Authorization header
 * 4. validateToken() checks signature, algorithm, expiry and subject on every request
 * 5. Past its expiry the token is rejected; nothing is revoked or stored
 *
 * @see com.ragplatform.auth.service.AuthService for token issuance context
 * @see JwtAuthenticationFilter for request-time validation
 */
@Slf4j
@Component
public class JwtUtil {

    /** Claim holding the role labels as a JSON array. */
    public static final String ROLES_CLAIM = "roles";

    private final JwtProperties properties;
    private final Clock clock;
    private final SignatureAlgorithm signatureAlgorithm;
    private final Key signingKey;
    private final JwtParser parser;

    public JwtUtil(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.signatureAlgorithm = properties.signatureAlgorithm();
        this.signingKey = new SecretKeySpec(
                properties.secret().getBytes(StandardCharsets.UTF_8), signatureAlgorithm.getJcaName());
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .build();
        log.info("JWT signing configured: algorithm={}, default lifetime={} min",
                signatureAlgorithm.getValue(), properties.expirationMinutes());
    }

    /**
     * Generate a token with the configured default lifetime.
     *
     * @param email subject of the token
     * @param roles roles to embed
     * @return Signed JWT token string (header.payload.signature)
     */
    public String generateToken(String email, Collection<String> roles) {
        return generateToken(email, roles, properties.expirationMinutes());
    }

    /**
     * Generate a signed token for an authenticated principal.
     *
     * Creates a JWT with:
     * - Subject (sub): the principal's email
     * - roles: the principal's role labels
     * - Issued At (iat): now
     * - Expiration (exp): now + ttlMinutes
     *
     * @param email      subject of the token
     * @param roles      roles to embed
     * @param ttlMinutes lifetime in minutes, must be positive
     * @return Signed JWT token string
     * @throws IllegalArgumentException if ttlMinutes is not positive
     */
    public String generateToken(String email, Collection<String> roles, long ttlMinutes) {
        if (ttlMinutes <= 0) {
            throw new IllegalArgumentException("ttlMinutes must be positive, got " + ttlMinutes);
        }
        Instant now = clock.instant();
        Map<String, Object> claims = new HashMap<>();
        claims.put(ROLES_CLAIM, new ArrayList<>(roles));

        return Jwts.builder()
                .setClaims(claims)
                .setSubject(email)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(ttlMinutes, ChronoUnit.MINUTES)))
                .signWith(signingKey, signatureAlgorithm)
                .compact();
    }

    /**
     * Validate a token and return the principal it carries.
     *
     * Checks, in order:
     * 1. Structure, signature and the configured algorithm (also for expired tokens)
     * 2. Expiry: rejected when the current instant is at or past exp
     * 3. Subject: must be present and non-blank
     *
     * @param token The JWT token string (without "Bearer " prefix)
     * @return principal built from sub and roles
     * @throws InvalidTokenException with the {@link TokenFailureReason} of the first failed check
     */
    public AuthenticatedPrincipal validateToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(TokenFailureReason.MALFORMED, "Token is empty");
        }

        Jws<Claims> jws;
        try {
            jws = parser.parseClaimsJws(token);
        } catch (ExpiredJwtException e) {
            requireConfiguredAlgorithm((String) e.getHeader().get(JwsHeader.ALGORITHM));
            throw new InvalidTokenException(TokenFailureReason.EXPIRED, "Token expired at " + e.getClaims().getExpiration(), e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(TokenFailureReason.MALFORMED, "Token could not be verified: " + e.getMessage(), e);
        }

        requireConfiguredAlgorithm(jws.getHeader().getAlgorithm());

        Claims claims = jws.getBody();
        Date expiration = claims.getExpiration();
        if (expiration == null) {
            throw new InvalidTokenException(TokenFailureReason.MALFORMED, "Token has no exp claim");
        }
        // the parser only rejects strictly-after; the boundary instant counts as expired
        if (!clock.instant().isBefore(expiration.toInstant())) {
            throw new InvalidTokenException(TokenFailureReason.EXPIRED, "Token expired at " + expiration);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException(TokenFailureReason.INVALID_SUBJECT, "Token has no subject");
        }

        return new AuthenticatedPrincipal(subject, extractRoles(claims));
    }

    private void requireConfiguredAlgorithm(String headerAlgorithm) {
        if (!signatureAlgorithm.getValue().equals(headerAlgorithm)) {
            throw new InvalidTokenException(TokenFailureReason.MALFORMED,
                    "Token signed with " + headerAlgorithm + ", expected " + signatureAlgorithm.getValue());
        }
    }

    private static Set<String> extractRoles(Claims claims) {
        Object raw = claims.get(ROLES_CLAIM);
        if (raw == null) {
            return Set.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new InvalidTokenException(TokenFailureReason.MALFORMED, "roles claim is not an array");
        }
        Set<String> roles = new LinkedHashSet<>();
        for (Object role : list) {
            if (role instanceof String value) {
                roles.add(value);
            }
        }
        return roles;
    }
}
