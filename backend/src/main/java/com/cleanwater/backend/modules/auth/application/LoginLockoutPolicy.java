package com.cleanwater.backend.modules.auth.application;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.cleanwater.backend.global.config.SecurityProperties;
import com.cleanwater.backend.modules.auth.domain.UserAccount;

import org.springframework.stereotype.Component;

/**
 * Consecutive-failure lockout. A lock is only a timestamp: the account counts as locked while
 * {@code now < lockedUntil} and becomes usable again on its own afterwards.
 */
@Component
public class LoginLockoutPolicy {

    private final int maxFailedAttempts;
    private final Duration lockDuration;

    public LoginLockoutPolicy(SecurityProperties properties) {
        this.maxFailedAttempts = properties.lockout().maxFailedAttempts();
        this.lockDuration = properties.lockout().lockDuration();
    }

    public boolean isLocked(UserAccount user, Instant now) {
        OffsetDateTime lockedUntil = user.getLockedUntil();
        return lockedUntil != null && now.isBefore(lockedUntil.toInstant());
    }

    /**
     * Whole seconds until the lock ends, rounded up; 0 when not locked.
     */
    public long remainingLockSeconds(UserAccount user, Instant now) {
        if (!isLocked(user, now)) {
            return 0L;
        }
        Duration remaining = Duration.between(now, user.getLockedUntil().toInstant());
        long seconds = remaining.getSeconds();
        return remaining.getNano() > 0 ? seconds + 1 : seconds;
    }

    /**
     * Counts one failed verification.
     *
     * @return true if this failure (re)armed the lock
     */
    public boolean recordFailure(UserAccount user, Instant now) {
        OffsetDateTime lockedUntil = user.getLockedUntil();
        if (lockedUntil != null && !now.isBefore(lockedUntil.toInstant())) {
            // expired lock: start a fresh series
            user.setLockedUntil(null);
            user.setFailedLoginAttempts(0);
        }
        int attempts = user.getFailedLoginAttempts() + 1;
        user.setFailedLoginAttempts(attempts);
        if (attempts >= maxFailedAttempts) {
            user.setLockedUntil(OffsetDateTime.ofInstant(now.plus(lockDuration), ZoneOffset.UTC));
            return true;
        }
        return false;
    }

    public void recordSuccess(UserAccount user, Instant now) {
        user.setFailedLoginAttempts(0);
        user.setLockedUntil(null);
        user.setLastLoginAt(OffsetDateTime.ofInstant(now, ZoneOffset.UTC));
    }
}
