package com.reelpilot.session.util;

import java.time.Duration;

/**
 * Single suspension point for every wait in a session. Returns false when the wait was interrupted.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper NONE = duration -> true;

    boolean sleep(Duration duration);

    default boolean sleepSeconds(double seconds) {
        if (seconds <= 0) {
            return true;
        }
        return sleep(Duration.ofMillis(Math.round(seconds * 1000)));
    }

    static Sleeper threadSleeper() {
        return duration -> {
            if (duration == null || duration.isZero() || duration.isNegative()) {
                return true;
            }
            try {
                Thread.sleep(duration.toMillis());
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        };
    }
}
