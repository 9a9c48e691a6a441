package com.ragplatform.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TokenResponse - body returned by a successful login.
 *
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "token_type": "bearer"
 * }
 * </pre>
 *
 * The client sends the token back as {@code Authorization: Bearer <access_token>}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    public static final String BEARER = "bearer";

    /** Compact JWS string (header.payload.signature). */
    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("token_type")
    @Builder.Default
    private String tokenType = BEARER;

    public static TokenResponse bearer(String accessToken) {
        return TokenResponse.builder()
                .accessToken(accessToken)
                .build();
    }
}
