package com.medexus.backend.modules.auth.presentation.dto;

public record AuthResponse(String accessToken, String tokenType, long expiresIn, UserProfileResponse user) {

    public static AuthResponse of(AccessToken token, UserProfileResponse user) {
        return new AuthResponse(token.accessToken(), token.tokenType(), token.expiresIn(), user);
    }
}
