package com.reelpilot.session.screen;

import com.reelpilot.session.util.Result;

import java.time.Duration;
import java.util.List;

/**
 * Low-level device automation primitives. Every call is synchronous; implementations try the
 * alternatives of a {@link LocatorSet} in order and report one result.
 */
public interface ScreenStateProvider {

    Result<Boolean> exists(LocatorSet locators, Duration timeout);

    Result<Void> click(LocatorSet locators, Duration timeout);

    Result<String> getText(LocatorSet locators, Duration timeout);

    Result<List<ScreenElement>> findAll(LocatorSet locators);

    Result<Void> tap(int x, int y);

    Result<Void> swipe(int x1, int y1, int x2, int y2, Duration duration);

    Result<Void> typeText(String text);

    Result<Void> pressEnter();

    Result<Void> pressBack();

    Result<Void> restartApp();

    Result<ScreenSize> screenSize();
}
