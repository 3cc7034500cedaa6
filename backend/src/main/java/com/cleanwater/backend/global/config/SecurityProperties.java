package com.cleanwater.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Immutable security settings bound from {@code cleanwater.security.*}.
 * Components receive this value through their constructors; nothing reads it from ambient state.
 */
@ConfigurationProperties(prefix = "cleanwater.security")
public record SecurityProperties(
        Jwt jwt,
        @DefaultValue Lockout lockout,
        @DefaultValue TwoFactor twoFactor,
        @DefaultValue Password password
) {

    public SecurityProperties {
        if (jwt == null) {
            throw new IllegalArgumentException("cleanwater.security.jwt.secret must be configured");
        }
    }

    public record Jwt(
            String secret,
            @DefaultValue("30m") Duration accessTokenTtl,
            @DefaultValue("7d") Duration refreshTokenTtl
    ) {
        public Jwt {
            if (secret == null || secret.isBlank()) {
                throw new IllegalArgumentException("cleanwater.security.jwt.secret must not be blank");
            }
            requirePositive(accessTokenTtl, "jwt.access-token-ttl");
            requirePositive(refreshTokenTtl, "jwt.refresh-token-ttl");
        }
    }

    public record Lockout(
            @DefaultValue("5") int maxFailedAttempts,
            @DefaultValue("15m") Duration lockDuration
    ) {
        public Lockout {
            if (maxFailedAttempts < 1) {
                throw new IllegalArgumentException("lockout.max-failed-attempts must be >= 1");
            }
            requirePositive(lockDuration, "lockout.lock-duration");
        }
    }

    public record TwoFactor(
            @DefaultValue("Clean Water in Hospital") String issuer,
            @DefaultValue("1") int allowedDriftSteps
    ) {
        public TwoFactor {
            if (allowedDriftSteps < 0) {
                throw new IllegalArgumentException("two-factor.allowed-drift-steps must be >= 0");
            }
        }
    }

    public record Password(@DefaultValue("8") int minLength) {
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
