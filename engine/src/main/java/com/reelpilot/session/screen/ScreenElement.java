package com.reelpilot.session.screen;

public record ScreenElement(
    String text,
    String contentDescription,
    Bounds bounds,
    boolean selected
) {
    public String textOrDescription() {
        if (text != null && !text.isBlank()) {
            return text;
        }
        return contentDescription;
    }
}
