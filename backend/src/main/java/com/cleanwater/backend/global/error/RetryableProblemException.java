package com.cleanwater.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Failure that clears by itself; {@link #getRetryAfterSeconds()} is surfaced as {@code Retry-After}.
 */
public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, long retryAfterSeconds) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RetryableProblemException locked(long retryAfterSeconds) {
        return new RetryableProblemException(
                HttpStatus.LOCKED,
                "auth.account_locked",
                "Account temporarily locked after repeated failed logins",
                retryAfterSeconds
        );
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
