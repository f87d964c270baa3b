package com.reelpilot.session.device;

import com.reelpilot.session.screen.LocatorSet;
import com.reelpilot.session.screen.ScreenElement;
import com.reelpilot.session.screen.ScreenSize;
import com.reelpilot.session.screen.ScreenStateProvider;
import com.reelpilot.session.util.ErrorKind;
import com.reelpilot.session.util.Result;

import java.time.Duration;
import java.util.List;

/**
 * Stand-in used while no device is configured. Every call fails as {@link ErrorKind#FATAL}.
 */
public class DisconnectedScreenStateProvider implements ScreenStateProvider {
    private static final String MESSAGE = "No device connected (session.device.enabled=false)";

    @Override
    public Result<Boolean> exists(LocatorSet locators, Duration timeout) {
        return fail();
    }

    @Override
    public Result<Void> click(LocatorSet locators, Duration timeout) {
        return fail();
    }

    @Override
    public Result<String> getText(LocatorSet locators, Duration timeout) {
        return fail();
    }

    @Override
    public Result<List<ScreenElement>> findAll(LocatorSet locators) {
        return fail();
    }

    @Override
    public Result<Void> tap(int x, int y) {
        return fail();
    }

    @Override
    public Result<Void> swipe(int x1, int y1, int x2, int y2, Duration duration) {
        return fail();
    }

    @Override
    public Result<Void> typeText(String text) {
        return fail();
    }

    @Override
    public Result<Void> pressEnter() {
        return fail();
    }

    @Override
    public Result<Void> pressBack() {
        return fail();
    }

    @Override
    public Result<Void> restartApp() {
        return fail();
    }

    @Override
    public Result<ScreenSize> screenSize() {
        return fail();
    }

    private static <T> Result<T> fail() {
        return Result.err(ErrorKind.FATAL, MESSAGE);
    }
}
