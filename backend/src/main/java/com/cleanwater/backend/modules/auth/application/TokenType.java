package com.cleanwater.backend.modules.auth.application;

/**
 * Value of the {@code type} claim. Access and refresh tokens are never interchangeable.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String getClaimValue() {
        return claimValue;
    }
}
