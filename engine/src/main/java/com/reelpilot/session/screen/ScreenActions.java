package com.reelpilot.session.screen;

import com.reelpilot.session.util.ErrorKind;
import com.reelpilot.session.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Element-level operations on top of {@link ScreenStateProvider}. Failures are reported as
 * {@code false}/empty; device-level failures are logged, never thrown.
 */
public class ScreenActions {
    private static final Logger log = LoggerFactory.getLogger(ScreenActions.class);
    private static final Duration SWIPE_DURATION = Duration.ofMillis(300);
    private static final ScreenSize FALLBACK_SIZE = new ScreenSize(1080, 2340);

    private final ScreenStateProvider provider;
    private final LocatorCatalog catalog;
    private final Duration lookupTimeout;
    private final Duration actionTimeout;
    private ScreenSize cachedSize;

    public ScreenActions(
        ScreenStateProvider provider,
        LocatorCatalog catalog,
        Duration lookupTimeout,
        Duration actionTimeout
    ) {
        this.provider = provider;
        this.catalog = catalog;
        this.lookupTimeout = lookupTimeout;
        this.actionTimeout = actionTimeout;
    }

    public LocatorCatalog catalog() {
        return catalog;
    }

    public Duration actionTimeout() {
        return actionTimeout;
    }

    public boolean isPresent(UiElement element) {
        return isPresent(catalog.get(element), lookupTimeout);
    }

    public boolean isPresent(UiElement element, Duration timeout) {
        return isPresent(catalog.get(element), timeout);
    }

    public boolean isPresent(LocatorSet locators, Duration timeout) {
        if (locators == null || locators.isEmpty()) {
            return false;
        }
        Result<Boolean> result = provider.exists(locators, timeout);
        report("exists", locators, result);
        return Boolean.TRUE.equals(result.orElse(false));
    }

    public boolean click(UiElement element) {
        return click(catalog.get(element), actionTimeout);
    }

    public boolean click(UiElement element, Duration timeout) {
        return click(catalog.get(element), timeout);
    }

    public boolean click(LocatorSet locators, Duration timeout) {
        if (locators == null || locators.isEmpty()) {
            return false;
        }
        Result<Void> result = provider.click(locators, timeout);
        report("click", locators, result);
        return result.isOk();
    }

    /**
     * Clicks the first element of {@code candidates} that can be clicked.
     */
    public boolean clickFirst(UiElement... candidates) {
        for (UiElement candidate : candidates) {
            if (click(catalog.get(candidate), lookupTimeout)) {
                return true;
            }
        }
        return false;
    }

    public Optional<String> text(UiElement element) {
        LocatorSet locators = catalog.get(element);
        if (locators.isEmpty()) {
            return Optional.empty();
        }
        Result<String> result = provider.getText(locators, lookupTimeout);
        report("getText", locators, result);
        return result.toOptional().map(String::trim).filter(value -> !value.isEmpty());
    }

    public List<ScreenElement> all(UiElement element) {
        LocatorSet locators = catalog.get(element);
        if (locators.isEmpty()) {
            return List.of();
        }
        Result<List<ScreenElement>> result = provider.findAll(locators);
        report("findAll", locators, result);
        return result.orElse(List.of());
    }

    public boolean tap(int x, int y) {
        Result<Void> result = provider.tap(x, y);
        if (result.isErr()) {
            log.debug("Tap at {},{} failed: {} {}", x, y, result.errorKind(), result.errorMessage());
        }
        return result.isOk();
    }

    /**
     * In-app back arrow when visible, otherwise the system back key.
     */
    public boolean back() {
        if (click(catalog.get(UiElement.BACK_BUTTON), lookupTimeout)) {
            return true;
        }
        return pressSystemBack();
    }

    public boolean pressSystemBack() {
        Result<Void> result = provider.pressBack();
        if (result.isErr()) {
            log.debug("System back failed: {} {}", result.errorKind(), result.errorMessage());
        }
        return result.isOk();
    }

    public boolean swipeToNextVideo() {
        ScreenSize size = screenSize();
        int x = size.width() / 2;
        return swipe(x, (int) (size.height() * 0.75), x, (int) (size.height() * 0.25));
    }

    public boolean scrollList() {
        ScreenSize size = screenSize();
        int x = size.width() / 2;
        return swipe(x, (int) (size.height() * 0.70), x, (int) (size.height() * 0.35));
    }

    public boolean swipeAwayBanner() {
        ScreenSize size = screenSize();
        int x = size.width() / 2;
        return swipe(x, (int) (size.height() * 0.08), x, 0);
    }

    public boolean restartApp() {
        Result<Void> result = provider.restartApp();
        if (result.isErr()) {
            log.warn("App restart failed: {} {}", result.errorKind(), result.errorMessage());
        }
        return result.isOk();
    }

    public boolean typeText(String text) {
        Result<Void> result = provider.typeText(text);
        if (result.isErr()) {
            log.debug("Typing failed: {} {}", result.errorKind(), result.errorMessage());
        }
        return result.isOk();
    }

    public boolean typeAndSubmit(String text) {
        if (!typeText(text)) {
            return false;
        }
        Result<Void> enter = provider.pressEnter();
        if (enter.isOk()) {
            return true;
        }
        return click(catalog.get(UiElement.SEARCH_SUBMIT), lookupTimeout);
    }

    public ScreenSize screenSize() {
        if (cachedSize != null) {
            return cachedSize;
        }
        Result<ScreenSize> result = provider.screenSize();
        if (result.isOk() && result.value() != null) {
            cachedSize = result.value();
            return cachedSize;
        }
        log.debug("Screen size unavailable ({}), using fallback", result.errorMessage());
        return FALLBACK_SIZE;
    }

    private boolean swipe(int x1, int y1, int x2, int y2) {
        Result<Void> result = provider.swipe(x1, y1, x2, y2, SWIPE_DURATION);
        if (result.isErr()) {
            log.debug("Swipe failed: {} {}", result.errorKind(), result.errorMessage());
        }
        return result.isOk();
    }

    private void report(String operation, LocatorSet locators, Result<?> result) {
        if (result.isOk() || result.isKind(ErrorKind.NOT_FOUND)) {
            return;
        }
        log.debug("{} on {} failed: {} {}", operation, locators.name(), result.errorKind(), result.errorMessage());
    }
}
