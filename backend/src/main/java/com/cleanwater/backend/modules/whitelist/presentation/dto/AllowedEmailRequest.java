package com.cleanwater.backend.modules.whitelist.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code email} is either {@code someone@example.com} or {@code @example.com}.
 */
public record AllowedEmailRequest(@NotBlank @Size(max = 255) String email) {
}
