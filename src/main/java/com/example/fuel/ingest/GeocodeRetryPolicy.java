package com.example.fuel.ingest;

import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff for transient geocoder failures.
 *
 * <p>With the defaults a location gets one initial attempt plus three retries, waiting 1s, 2s and
 * 4s before them.</p>
 */
@Value
public class GeocodeRetryPolicy {
    int maxRetries;
    Duration initialBackoff;
    double multiplier;

    public GeocodeRetryPolicy(int maxRetries, Duration initialBackoff, double multiplier) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
    }

    public static GeocodeRetryPolicy defaults() {
        return new GeocodeRetryPolicy(3, Duration.ofSeconds(1), 2.0);
    }

    /**
     * Wait before the given retry.
     *
     * @param retry 1-based retry number
     */
    public Duration backoffBefore(int retry) {
        if (retry < 1 || retry > maxRetries) {
            throw new IllegalArgumentException("retry must be in [1, " + maxRetries + "], got " + retry);
        }
        return Duration.ofMillis(Math.round(initialBackoff.toMillis() * Math.pow(multiplier, retry - 1)));
    }
}
