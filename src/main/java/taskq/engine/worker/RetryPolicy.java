package taskq.engine.worker;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(base * 2^n, cap)} for the n-th retry.
 */
public final class RetryPolicy {

    private final Duration base;
    private final Duration cap;

    public RetryPolicy(Duration base, Duration cap) {
        if (base.isNegative() || cap.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
        this.base = base;
        this.cap = cap;
    }

    /**
     * Delay before retry number {@code retryCount} (1 for the first retry).
     */
    public Duration backoff(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
        // 2^62 already overflows any useful cap
        int shift = Math.min(retryCount, 62);
        long factor = 1L << shift;
        long baseMs = base.toMillis();
        if (baseMs != 0 && factor > cap.toMillis() / baseMs) {
            return cap;
        }
        Duration delay = Duration.ofMillis(baseMs * factor);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
