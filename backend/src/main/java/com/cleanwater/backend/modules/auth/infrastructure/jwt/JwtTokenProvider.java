package com.cleanwater.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.cleanwater.backend.global.config.SecurityProperties;

import org.springframework.stereotype.Component;

/**
 * HMAC signing key shared by access and refresh tokens.
 * The configured secret may be Base64 or raw text and must provide at least 256 bits.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(SecurityProperties properties) {
        String secretString = properties.jwt().secret();
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_KEY_BYTES + " bytes for HS256");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
