package com.isolend.domain.model;

import com.isolend.exception.GovernanceException;
import java.time.Duration;
import java.util.Map;

/**
 * A governed value waiting out its timelock.
 *
 * <p>Acceptable in the window {@code [validAfter, validAfter + deadline]}; before the window the
 * update is too early, after it the update has lapsed and must be rejected or re-requested.
 *
 * @param value the value that will take effect on acceptance
 * @param validAfter epoch second from which the update may be accepted
 */
public record PendingUpdate<T>(T value, long validAfter) {

    public static <T> PendingUpdate<T> requested(T value, long now, Duration timelock) {
        return new PendingUpdate<>(value, now + timelock.toSeconds());
    }

    /** Throws unless {@code now} falls inside the acceptance window. */
    public void requireAcceptable(long now, Duration deadline, String what) {
        if (now < validAfter) {
            throw new GovernanceException(
                    GovernanceException.Reason.TIMELOCK_NOT_ELAPSED,
                    what + " is not acceptable before " + validAfter + " (now " + now + ")",
                    Map.of("validAfter", validAfter, "now", now));
        }
        if (now > validAfter + deadline.toSeconds()) {
            throw new GovernanceException(
                    GovernanceException.Reason.TIMELOCK_EXPIRED,
                    what + " lapsed at " + (validAfter + deadline.toSeconds()) + " (now " + now + ")",
                    Map.of("validAfter", validAfter, "now", now));
        }
    }

    /** Returns {@code pending} or fails with NO_PENDING_UPDATE when it is null. */
    public static <T> PendingUpdate<T> require(PendingUpdate<T> pending, String what) {
        if (pending == null) {
            throw new GovernanceException(GovernanceException.Reason.NO_PENDING_UPDATE, "No pending " + what);
        }
        return pending;
    }
}
