package com.mike.recruiteroutreach.service;

import java.time.Duration;

/**
 * Pause between paced outbound calls. Swapped for a recording no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
