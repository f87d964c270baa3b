package com.reelpilot.session.screen;

public record ScreenSize(
    int width,
    int height
) {
}
