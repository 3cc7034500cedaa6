package com.cleanwater.backend.support;

import java.time.Duration;

import com.cleanwater.backend.global.config.SecurityProperties;

public final class TestSecurityProperties {

    public static final String SECRET = "unit-test-hs256-secret-that-is-long-enough!";

    private TestSecurityProperties() {
    }

    public static SecurityProperties defaults() {
        return new SecurityProperties(
                new SecurityProperties.Jwt(SECRET, Duration.ofMinutes(30), Duration.ofDays(7)),
                new SecurityProperties.Lockout(5, Duration.ofMinutes(15)),
                new SecurityProperties.TwoFactor("Clean Water in Hospital", 1),
                new SecurityProperties.Password(8)
        );
    }
}
