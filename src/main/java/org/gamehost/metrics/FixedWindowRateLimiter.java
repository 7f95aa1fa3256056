package org.gamehost.metrics;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * 固定窗口限流：每个窗口最多放行一次
 */
public class FixedWindowRateLimiter implements RateLimiter {

    private static final long NEVER = Long.MIN_VALUE;

    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final AtomicLong lastAcquired = new AtomicLong(NEVER);

    public FixedWindowRateLimiter(Duration interval) {
        this(interval, System::nanoTime);
    }

    public FixedWindowRateLimiter(Duration interval, LongSupplier nanoClock) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("限流间隔必须为正数: " + interval);
        }
        this.intervalNanos = interval.toNanos();
        this.nanoClock = nanoClock;
    }

    @Override
    public boolean tryAcquire() {
        long now = nanoClock.getAsLong();
        while (true) {
            long last = lastAcquired.get();
            if (last != NEVER && now - last < intervalNanos) {
                return false;
            }
            if (lastAcquired.compareAndSet(last, now)) {
                return true;
            }
        }
    }

    public Duration getInterval() {
        return Duration.ofNanos(intervalNanos);
    }
}
