package com.reelpilot.session.navigation;

import com.reelpilot.session.model.PageState;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * One transition of a composite flow. The step is confirmed when the page detector reports
 * {@code expected} (if set) and {@code arrived} holds (if set); with neither, a successful action
 * confirms it.
 */
public record NavigationStep(
    String name,
    BooleanSupplier action,
    BooleanSupplier alternate,
    PageState expected,
    BooleanSupplier arrived,
    Duration timeout,
    int maxRetries
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_RETRIES = 2;

    public NavigationStep {
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        maxRetries = Math.max(0, maxRetries);
    }

    public static NavigationStep of(String name, BooleanSupplier action) {
        return new NavigationStep(name, action, null, null, null, null, DEFAULT_MAX_RETRIES);
    }

    public NavigationStep expect(PageState state) {
        return new NavigationStep(name, action, alternate, state, arrived, timeout, maxRetries);
    }

    public NavigationStep until(BooleanSupplier condition) {
        return new NavigationStep(name, action, alternate, expected, condition, timeout, maxRetries);
    }

    public NavigationStep orElse(BooleanSupplier alternateAction) {
        return new NavigationStep(name, action, alternateAction, expected, arrived, timeout, maxRetries);
    }

    public NavigationStep within(Duration stepTimeout, int retries) {
        return new NavigationStep(name, action, alternate, expected, arrived, stepTimeout, retries);
    }

    public boolean hasConfirmation() {
        return expected != null || arrived != null;
    }
}
