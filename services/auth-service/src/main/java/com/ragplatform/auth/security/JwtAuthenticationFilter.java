package com.ragplatform.auth.security;

import com.ragplatform.auth.exception.InvalidTokenException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Reads {@code Authorization: Bearer <token>}, validates the token and, on
 * success, installs an {@link AuthenticatedPrincipal} in the security context.
 *
 * <p>A rejected token leaves the request anonymous; the failure reason is
 * stored under {@link #TOKEN_FAILURE_ATTRIBUTE} so the entry point can pick
 * the right 401 message.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String TOKEN_FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".TOKEN_FAILURE";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtUtil jwtUtil;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            if (token.isEmpty()) {
                // an empty credential counts as no credential
                filterChain.doFilter(request, response);
                return;
            }
            try {
                AuthenticatedPrincipal principal = jwtUtil.validateToken(token);
                List<SimpleGrantedAuthority> authorities = principal.roles().stream()
                        .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
                        .toList();

                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(UsernamePasswordAuthenticationToken.authenticated(principal, null, authorities));
                SecurityContextHolder.setContext(context);
                log.debug("Authenticated {} on {} {}", principal.email(), request.getMethod(), request.getRequestURI());
            } catch (InvalidTokenException e) {
                log.debug("Bearer token rejected on {} {}: reason={}, detail={}",
                        request.getMethod(), request.getRequestURI(), e.getReason(), e.getMessage());
                SecurityContextHolder.clearContext();
                request.setAttribute(TOKEN_FAILURE_ATTRIBUTE, e.getReason());
            }
        }

        filterChain.doFilter(request, response);
    }
}
