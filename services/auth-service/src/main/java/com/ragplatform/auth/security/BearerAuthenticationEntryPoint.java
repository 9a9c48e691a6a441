package com.ragplatform.auth.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragplatform.auth.dto.ErrorResponse;
import com.ragplatform.auth.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes the 401 response for a protected route reached without a valid
 * bearer token. A missing token and a rejected token get different messages;
 * the rejection reason itself is not exposed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BearerAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        ErrorCode errorCode = request.getAttribute(JwtAuthenticationFilter.TOKEN_FAILURE_ATTRIBUTE) != null
                ? ErrorCode.INVALID_TOKEN
                : ErrorCode.NOT_AUTHENTICATED;
        log.debug("Unauthenticated request to {} {}: {}", request.getMethod(), request.getRequestURI(), errorCode.getCode());

        response.setStatus(errorCode.getHttpStatus());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(errorCode));
    }
}
