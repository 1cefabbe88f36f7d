package com.payment.gateway.core;

import io.github.resilience4j.core.IntervalFunction;
import lombok.Value;

import java.time.Duration;

/**
 * How long the barcode path keeps confirming a payment: at most {@code maxAttempts} queries,
 * separated by the delays of {@code interval}.
 */
@Value
public class PollingPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

    int maxAttempts;
    IntervalFunction interval;

    public PollingPolicy(int maxAttempts, IntervalFunction interval) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.interval = interval;
    }

    /**
     * Same delay between every pair of attempts. A zero interval polls back to back.
     */
    public static PollingPolicy fixed(int maxAttempts, Duration interval) {
        if (interval.isZero()) {
            return new PollingPolicy(maxAttempts, attempt -> 0L);
        }
        return new PollingPolicy(maxAttempts, IntervalFunction.of(interval));
    }

    public static PollingPolicy defaults() {
        return fixed(DEFAULT_MAX_ATTEMPTS, DEFAULT_INTERVAL);
    }

    /**
     * Delay to wait after attempt {@code completedAttempts} before the next one.
     */
    public Duration delayAfter(int completedAttempts) {
        return Duration.ofMillis(interval.apply(completedAttempts));
    }
}
