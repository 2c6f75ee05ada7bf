package com.medexus.backend.global.security;

import java.util.UUID;

import com.medexus.backend.modules.auth.domain.Role;

/**
 * Authenticated actor resolved from a bearer token.
 */
public record JwtAuthenticationPrincipal(UUID userId, String email, Role role) {

    public boolean hasRole(Role expected) {
        return role == expected;
    }
}
