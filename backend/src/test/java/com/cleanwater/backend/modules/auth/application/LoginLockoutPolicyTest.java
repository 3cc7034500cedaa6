package com.cleanwater.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import com.cleanwater.backend.modules.access.domain.AccessRole;
import com.cleanwater.backend.modules.auth.domain.UserAccount;
import com.cleanwater.backend.support.OrganizationFixtures;
import com.cleanwater.backend.support.TestSecurityProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoginLockoutPolicyTest {

    private static final Instant NOW = Instant.parse("2025-03-01T08:00:00Z");

    private LoginLockoutPolicy policy;
    private UserAccount user;

    @BeforeEach
    void setUp() {
        policy = new LoginLockoutPolicy(TestSecurityProperties.defaults());
        user = OrganizationFixtures.user(1L, "alice", AccessRole.HOSPITAL_USER);
    }

    @Test
    void locksOnTheFifthConsecutiveFailure() {
        for (int i = 1; i <= 4; i++) {
            assertThat(policy.recordFailure(user, NOW)).isFalse();
        }
        assertThat(policy.isLocked(user, NOW)).isFalse();

        assertThat(policy.recordFailure(user, NOW)).isTrue();

        assertThat(user.getFailedLoginAttempts()).isEqualTo(5);
        assertThat(user.getLockedUntil().toInstant()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(policy.isLocked(user, NOW)).isTrue();
        assertThat(policy.remainingLockSeconds(user, NOW)).isEqualTo(900L);
    }

    @Test
    void lockIsAdvisoryAndEndsExactlyAtExpiry() {
        lockOut();
        Instant expiry = NOW.plus(Duration.ofMinutes(15));

        assertThat(policy.isLocked(user, expiry.minusMillis(1))).isTrue();
        assertThat(policy.remainingLockSeconds(user, expiry.minusMillis(1))).isEqualTo(1L);
        assertThat(policy.isLocked(user, expiry)).isFalse();
        assertThat(policy.remainingLockSeconds(user, expiry)).isZero();
    }

    @Test
    void successClearsCounterAndLock() {
        lockOut();
        Instant later = NOW.plus(Duration.ofMinutes(16));

        policy.recordSuccess(user, later);

        assertThat(user.getFailedLoginAttempts()).isZero();
        assertThat(user.getLockedUntil()).isNull();
        assertThat(user.getLastLoginAt().toInstant()).isEqualTo(later);
    }

    @Test
    void failureAfterAnExpiredLockStartsAFreshSeries() {
        lockOut();
        Instant later = NOW.plus(Duration.ofMinutes(20));

        assertThat(policy.recordFailure(user, later)).isFalse();

        assertThat(user.getFailedLoginAttempts()).isEqualTo(1);
        assertThat(policy.isLocked(user, later)).isFalse();
    }

    @Test
    void failureWhileLockedReArmsTheLock() {
        lockOut();
        Instant later = NOW.plus(Duration.ofMinutes(10));

        assertThat(policy.recordFailure(user, later)).isTrue();

        assertThat(user.getLockedUntil().toInstant()).isEqualTo(later.plus(Duration.ofMinutes(15)));
    }

    private void lockOut() {
        for (int i = 0; i < 5; i++) {
            policy.recordFailure(user, NOW);
        }
    }
}
