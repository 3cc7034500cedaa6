package com.cleanwater.backend.modules.device.infrastructure;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

/**
 * Device secrets: {@code sk_} followed by 32 random bytes in URL-safe Base64.
 */
@Component
public class ApiKeyGenerator {

    public static final String PREFIX = "sk_";
    private static final int RANDOM_BYTES = 32;

    private final SecureRandom secureRandom = new SecureRandom();

    public String generate() {
        byte[] bytes = new byte[RANDOM_BYTES];
        secureRandom.nextBytes(bytes);
        return PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
