package com.cleanwater.backend.global.security;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.springframework.security.crypto.bcrypt.BCrypt;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * BCrypt encoder that cuts the UTF-8 encoded password to the 72 bytes the algorithm reads.
 * Hashing and matching truncate identically, so longer passwords keep working but bytes past
 * the limit do not contribute to the hash.
 */
public class TruncatingBCryptPasswordEncoder implements PasswordEncoder {

    static final int MAX_PASSWORD_BYTES = 72;

    private final int strength;

    public TruncatingBCryptPasswordEncoder() {
        this(10);
    }

    public TruncatingBCryptPasswordEncoder(int strength) {
        this.strength = strength;
    }

    @Override
    public String encode(CharSequence rawPassword) {
        if (rawPassword == null) {
            throw new IllegalArgumentException("rawPassword cannot be null");
        }
        return BCrypt.hashpw(truncate(rawPassword), BCrypt.gensalt(strength));
    }

    @Override
    public boolean matches(CharSequence rawPassword, String encodedPassword) {
        if (rawPassword == null || encodedPassword == null || encodedPassword.isEmpty()) {
            return false;
        }
        try {
            return BCrypt.checkpw(truncate(rawPassword), encodedPassword);
        } catch (IllegalArgumentException ex) {
            // malformed stored hash
            return false;
        }
    }

    static byte[] truncate(CharSequence rawPassword) {
        byte[] bytes = rawPassword.toString().getBytes(StandardCharsets.UTF_8);
        return bytes.length <= MAX_PASSWORD_BYTES ? bytes : Arrays.copyOf(bytes, MAX_PASSWORD_BYTES);
    }
}
