package com.roundgrader.utils;

import java.time.Duration;

/**
 * Blocking pause used between retry attempts and between participants.
 * Tests substitute an implementation that records the requested delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
