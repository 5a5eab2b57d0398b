package com.trading.opg.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often an error is written to a logger. Used by indicator code
 * that may fail on every bar of a long series.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    /**
     * Logs at ERROR unless another call logged within the interval.
     *
     * @return {@code true} if the message was written
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // only one thread may win the slot for this interval
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0)
                logger.error("{} (throttled, {} similar errors suppressed)", message, dropped, t);
            else
                logger.error(message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
