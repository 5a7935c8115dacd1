package com.example.fuel.ingest;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum spacing between consecutive requests. Single-threaded use only.
 */
public class RequestThrottle {

    private final long minIntervalNanos;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;
    private long lastRequestNanos;
    private boolean started;

    public RequestThrottle(Duration minInterval) {
        this(minInterval, System::nanoTime, Sleeper.SYSTEM);
    }

    public RequestThrottle(Duration minInterval, LongSupplier nanoTime, Sleeper sleeper) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        this.minIntervalNanos = minInterval.toNanos();
        this.nanoTime = nanoTime;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a request may be sent, then records it as sent.
     */
    public void acquire() throws InterruptedException {
        if (started) {
            long wait = minIntervalNanos - (nanoTime.getAsLong() - lastRequestNanos);
            if (wait > 0) {
                sleeper.sleep(Duration.ofNanos(wait));
            }
        }
        started = true;
        lastRequestNanos = nanoTime.getAsLong();
    }
}
