package com.cleanwater.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Either a token pair, or {@code twoFactorRequired=true} with no tokens when the account
 * must still pass {@code /api/auth/verify-2fa}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(boolean twoFactorRequired, TokenPairResponse tokens) {

    public static LoginResponse authenticated(TokenPairResponse tokens) {
        return new LoginResponse(false, tokens);
    }

    public static LoginResponse secondFactorRequired() {
        return new LoginResponse(true, null);
    }
}
