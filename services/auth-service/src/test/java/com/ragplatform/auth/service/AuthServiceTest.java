package com.ragplatform.auth.service;

import com.ragplatform.auth.config.JwtProperties;
import com.ragplatform.auth.dto.TokenResponse;
import com.ragplatform.auth.exception.AuthenticationFailedException;
import com.ragplatform.auth.exception.ErrorCode;
import com.ragplatform.auth.model.CredentialRecord;
import com.ragplatform.auth.repository.CredentialRepository;
import com.ragplatform.auth.repository.InMemoryCredentialRepository;
import com.ragplatform.auth.security.AuthenticatedPrincipal;
import com.ragplatform.auth.security.JwtUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for AuthService.
 *
 * <p>Uses the real demo account table with a low BCrypt cost.</p>
 */
class AuthServiceTest {

    private PasswordEncoder passwordEncoder;
    private JwtUtil jwtUtil;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        passwordEncoder = spy(new BCryptPasswordEncoder(4));
        CredentialRepository repository = new InMemoryCredentialRepository(passwordEncoder);
        jwtUtil = new JwtUtil(new JwtProperties("service-test-secret-0123456789-abcdefghij", "HS256", 30), Clock.systemUTC());
        authService = new AuthService(repository, passwordEncoder, jwtUtil);
    }

    @Test
    @DisplayName("Should authenticate each demo account with its stored roles")
    void testAuthenticateDemoAccounts() {
        assertEquals(Set.of("admin", "moderator", "expert", "user"),
                authService.authenticate("admin@example.com", "admin123").roles());
        assertEquals(Set.of("expert", "user"),
                authService.authenticate("expert@example.com", "expert123").roles());
        assertEquals(Set.of("user"),
                authService.authenticate("user@example.com", "user123").roles());
    }

    @Test
    @DisplayName("Should fail identically for an unknown email and a wrong password")
    void testNoEnumeration() {
        AuthenticationFailedException unknown = assertThrows(AuthenticationFailedException.class,
                () -> authService.authenticate("nobody@example.com", "admin123"));
        AuthenticationFailedException wrongPassword = assertThrows(AuthenticationFailedException.class,
                () -> authService.authenticate("admin@example.com", "wrong"));

        assertEquals(ErrorCode.INCORRECT_CREDENTIALS, unknown.getErrorCode());
        assertEquals(unknown.getErrorCode(), wrongPassword.getErrorCode());
        assertEquals(unknown.getMessage(), wrongPassword.getMessage());
        assertEquals("Incorrect username or password", unknown.getMessage());
    }

    @Test
    @DisplayName("Should run a hash comparison even when the email is unknown")
    void testUnknownEmailStillHashes() {
        assertThrows(AuthenticationFailedException.class,
                () -> authService.authenticate("nobody@example.com", "whatever"));

        verify(passwordEncoder, times(1)).matches(eq("whatever"), anyString());
    }

    @Test
    @DisplayName("Should reject empty and null inputs")
    void testEmptyInputs() {
        assertThrows(AuthenticationFailedException.class, () -> authService.authenticate("", "admin123"));
        assertThrows(AuthenticationFailedException.class, () -> authService.authenticate("admin@example.com", ""));
        assertThrows(AuthenticationFailedException.class, () -> authService.authenticate(null, null));
    }

    @Test
    @DisplayName("Should issue a bearer token that validates back to the account")
    void testLogin() {
        // Act
        TokenResponse response = authService.login("expert@example.com", "expert123");

        // Assert
        assertEquals("bearer", response.getTokenType());
        AuthenticatedPrincipal principal = jwtUtil.validateToken(response.getAccessToken());
        assertEquals("expert@example.com", principal.email());
        assertEquals(Set.of("expert", "user"), principal.roles());
    }

    @Test
    @DisplayName("Should not mint a token when credentials are wrong")
    void testLoginFailure() {
        JwtUtil tokenMock = mock(JwtUtil.class);
        CredentialRepository repository = email -> Optional.of(
                new CredentialRecord("a@example.com", passwordEncoder.encode("right"), Set.of("user")));
        AuthService service = new AuthService(repository, passwordEncoder, tokenMock);

        assertThrows(AuthenticationFailedException.class, () -> service.login("a@example.com", "wrong"));
        verify(tokenMock, never()).generateToken(anyString(), anyCollection());
    }
}
