package io.envkeeper.server.recovery;

import java.time.Duration;

/**
 * Bounded retry schedule for restoring a lost session.
 * <p>
 * The first attempt runs immediately. After a failed attempt n the next one
 * waits {@code initialBackoff * multiplier^(n-1)}, capped at {@code maxBackoff}.
 */
public record RecoveryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RecoveryPolicy {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        if (initialBackoff.isNegative()) throw new IllegalArgumentException("initialBackoff must be >= 0");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
        if (maxBackoff.compareTo(initialBackoff) < 0) throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
    }

    public static RecoveryPolicy defaults() {
        return of(3, Duration.ofSeconds(1));
    }

    /** Doubling backoff capped at 60s, or at initialBackoff if that is larger. */
    public static RecoveryPolicy of(int maxAttempts, Duration initialBackoff) {
        Duration cap = Duration.ofSeconds(60);
        return new RecoveryPolicy(maxAttempts, initialBackoff, 2.0,
                initialBackoff.compareTo(cap) > 0 ? initialBackoff : cap);
    }

    /** Delay before the attempt that follows failed attempt {@code failedAttempt} (1-based). */
    public Duration delayAfter(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
