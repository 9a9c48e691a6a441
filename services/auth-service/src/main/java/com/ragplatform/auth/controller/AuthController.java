package com.ragplatform.auth.controller;

import com.ragplatform.auth.config.OpenApiConfig;
import com.ragplatform.auth.dto.CurrentUserResponse;
import com.ragplatform.auth.dto.TokenResponse;
import com.ragplatform.auth.security.AuthenticatedPrincipal;
import com.ragplatform.auth.security.RoleGate;
import com.ragplatform.auth.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * AuthController - REST endpoints for login and token-protected resources.
 *
 * Endpoints:
 * - POST /login       - Exchange form-encoded username/password for a bearer token
 * - GET  /me          - Principal carried by the presented token (requires auth)
 * - GET  /admin/ping  - Admin-only probe (requires auth + role "admin")
 *
 * Error Handling:
 * - 400 Bad Request: Incorrect username or password
 * - 401 Unauthorized: Missing, invalid or expired token
 * - 403 Forbidden: Valid token without the required role
 * - 422 Unprocessable Entity: Missing form field on login
 *
 * @see AuthService for credential checks
 * @see RoleGate for role enforcement
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    static final Set<String> ADMIN_ROLES = Set.of("admin");

    private final AuthService authService;

    @Operation(summary = "Obtain a JWT access token (demo accounts)")
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<TokenResponse> login(@RequestParam String username, @RequestParam String password) {
        return ResponseEntity.ok(authService.login(username, password));
    }

    @Operation(summary = "Current user (requires JWT)", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    @GetMapping("/me")
    public ResponseEntity<CurrentUserResponse> me(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(CurrentUserResponse.from(principal));
    }

    @Operation(summary = "Admin only", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    @GetMapping("/admin/ping")
    public ResponseEntity<Map<String, Object>> adminPing(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        RoleGate.requireAnyRole(principal, ADMIN_ROLES);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("scope", "admin");
        return ResponseEntity.ok(body);
    }
}
