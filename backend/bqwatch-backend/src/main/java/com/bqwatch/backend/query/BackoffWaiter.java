package com.bqwatch.backend.query;

import java.time.Duration;

/**
 * Suspension point between two polls of a pending job. Implementations must be interruptible so a
 * caller can cancel a run.
 */
@FunctionalInterface
public interface BackoffWaiter {

    void await(Duration interval) throws InterruptedException;

    static BackoffWaiter sleeping() {
        return interval -> Thread.sleep(interval.toMillis());
    }
}
