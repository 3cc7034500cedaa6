package com.cleanwater.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record TwoFactorLoginRequest(
        @NotBlank String username,
        @NotBlank @Pattern(regexp = "\\d{6}", message = "must be a 6-digit code") String code
) {
}
