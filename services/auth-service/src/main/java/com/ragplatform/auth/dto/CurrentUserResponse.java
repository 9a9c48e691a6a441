package com.ragplatform.auth.dto;

import com.ragplatform.auth.security.AuthenticatedPrincipal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * CurrentUserResponse - the principal behind the presented bearer token,
 * as returned by {@code GET /me}. Built from token claims only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentUserResponse {

    private String email;

    private List<String> roles;

    public static CurrentUserResponse from(AuthenticatedPrincipal principal) {
        return CurrentUserResponse.builder()
                .email(principal.email())
                .roles(List.copyOf(principal.roles()))
                .build();
    }
}
