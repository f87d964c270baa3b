package com.reelpilot.session.model;

/**
 * A row of a followers/following list. {@code centerX}/{@code centerY} locate the username text
 * so the row can be opened without touching the avatar (which may open a story); the button
 * coordinates are zero when the row has no button.
 */
public record ListRow(
    String username,
    String displayName,
    String buttonLabel,
    int centerX,
    int centerY,
    int buttonX,
    int buttonY
) {
    public boolean hasButton() {
        return buttonLabel != null && (buttonX > 0 || buttonY > 0);
    }

    public Target toTarget(TargetOrigin origin) {
        return Target.row(username, origin, buttonLabel);
    }
}
