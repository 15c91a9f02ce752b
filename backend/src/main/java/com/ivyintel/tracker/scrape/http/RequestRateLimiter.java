package com.ivyintel.tracker.scrape.http;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a minimum gap between request dispatches across every caller sharing this instance.
 * Only dispatch timing is serialized; callers proceed independently once {@link #acquire()} returns.
 */
public class RequestRateLimiter {
    private final long minGapNanos;
    private final ReentrantLock lock = new ReentrantLock(true);
    private long lastDispatchNanos;
    private boolean dispatched;

    public RequestRateLimiter(Duration minGap) {
        this.minGapNanos = minGap == null || minGap.isNegative() ? 0L : minGap.toNanos();
    }

    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (dispatched && minGapNanos > 0) {
                long waitNanos = minGapNanos - (System.nanoTime() - lastDispatchNanos);
                if (waitNanos > 0) {
                    Thread.sleep(waitNanos / 1_000_000L, (int) (waitNanos % 1_000_000L));
                }
            }
            lastDispatchNanos = System.nanoTime();
            dispatched = true;
        } finally {
            lock.unlock();
        }
    }
}
