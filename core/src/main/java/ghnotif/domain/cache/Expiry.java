package ghnotif.domain.cache;

import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;

/**
 * Converts TTLs into absolute expiry times in epoch milliseconds, where 0 means the entry never expires.
 */
final class Expiry {
    static final long NEVER = 0;

    private Expiry() {
    }

    static long expiresAt(final Clock clock, @Nullable final Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return NEVER;
        }

        return clock.millis() + ttl.toMillis();
    }

    static boolean isExpired(final Clock clock, final long expiresAt) {
        return expiresAt != NEVER && clock.millis() >= expiresAt;
    }
}
