package com.cleanwater.backend.modules.auth.presentation.dto;

public record TokenPairResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn,
        long refreshExpiresIn
) {
    public static final String DEFAULT_TOKEN_TYPE = "bearer";
}
