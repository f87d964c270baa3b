package com.reelpilot.session.screen;

public record Bounds(
    int left,
    int top,
    int right,
    int bottom
) {
    public int centerX() {
        return (left + right) / 2;
    }

    public int centerY() {
        return (top + bottom) / 2;
    }

    public int height() {
        return Math.max(0, bottom - top);
    }
}
