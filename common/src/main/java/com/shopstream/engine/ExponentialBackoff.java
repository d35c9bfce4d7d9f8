package com.shopstream.engine;

/**
 * Exponential backoff schedule: {@code initial * 2^(attempt-1)}, capped at {@code max}.
 *
 * <p>Stateless, so one instance can be shared by every retry loop that uses the same
 * settings.</p>
 */
public class ExponentialBackoff {

    private final long initialMs;
    private final long maxMs;

    public ExponentialBackoff(long initialMs, long maxMs) {
        if (initialMs <= 0 || maxMs < initialMs) {
            throw new IllegalArgumentException(
                    "Invalid backoff bounds: initial=" + initialMs + " max=" + maxMs);
        }
        this.initialMs = initialMs;
        this.maxMs = maxMs;
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public long delayMs(int attempt) {
        if (attempt <= 1) {
            return initialMs;
        }
        int shift = Math.min(attempt - 1, 30);
        long delay = initialMs << shift;
        if (delay <= 0 || delay > maxMs) {
            return maxMs;
        }
        return delay;
    }
}
