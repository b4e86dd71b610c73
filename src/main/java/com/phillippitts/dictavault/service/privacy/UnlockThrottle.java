package com.phillippitts.dictavault.service.privacy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Counts consecutive failed unlocks and opens a lockout window after too many.
 *
 * <p>While the window is open, unlock attempts are rejected without checking the password.
 * A successful unlock resets the counter. Guarded by the owning {@link VaultState}'s monitor.
 */
final class UnlockThrottle {

    private final int maxFailedAttempts;
    private final Duration lockout;
    private final Clock clock;

    private int consecutiveFailures;
    private Instant lockedUntil = Instant.MIN;

    UnlockThrottle(int maxFailedAttempts, Duration lockout, Clock clock) {
        if (maxFailedAttempts <= 0) {
            throw new IllegalArgumentException("maxFailedAttempts must be > 0");
        }
        this.maxFailedAttempts = maxFailedAttempts;
        this.lockout = lockout;
        this.clock = clock;
    }

    boolean isLockedOut() {
        return clock.instant().isBefore(lockedUntil);
    }

    void recordFailure() {
        consecutiveFailures++;
        if (consecutiveFailures >= maxFailedAttempts) {
            lockedUntil = clock.instant().plus(lockout);
            consecutiveFailures = 0;
        }
    }

    void recordSuccess() {
        consecutiveFailures = 0;
        lockedUntil = Instant.MIN;
    }
}
