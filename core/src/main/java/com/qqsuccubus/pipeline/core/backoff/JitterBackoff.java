package com.qqsuccubus.pipeline.core.backoff;

import java.time.Duration;

/**
 * Jittered exponential backoff calculator.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) * uniform(0.5, 1.5)}
 * <ul>
 *   <li>{@code base}: Initial delay</li>
 *   <li>{@code max}: Maximum delay (cap applied before jitter)</li>
 * </ul>
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the delay for an explicit jitter factor.
     *
     * @param attempt      Retry attempt number (0-based)
     * @param base         Base delay
     * @param max          Maximum delay (cap)
     * @param jitterFactor Multiplier, expected in {@code [0.5, 1.5)}
     * @return Computed delay
     */
    public static Duration next(int attempt, Duration base, Duration max, double jitterFactor) {
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20)); // Cap exponent to avoid overflow

        long cappedMs = Math.min(expMs, max.toMillis());

        return Duration.ofMillis(Math.round(cappedMs * jitterFactor));
    }
}
