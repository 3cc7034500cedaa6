package com.cleanwater.backend.modules.auth.presentation.dto;

/**
 * Returned once when the second factor is switched on. {@code qrCode} is a PNG {@code data:} URI
 * of {@code provisioningUri}.
 */
public record TwoFactorEnrollmentResponse(String secret, String provisioningUri, String qrCode) {
}
