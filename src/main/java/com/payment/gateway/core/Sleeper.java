package com.payment.gateway.core;

import java.time.Duration;

/**
 * Suspends the calling thread between poll attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
