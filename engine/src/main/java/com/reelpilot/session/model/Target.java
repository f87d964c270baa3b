package com.reelpilot.session.model;

import com.reelpilot.session.util.UsernameRules;

/**
 * One candidate unit of interaction surfaced by the current screen. {@code details} is only
 * present for videos.
 */
public record Target(
    String identifier,
    TargetOrigin origin,
    String statusLabel,
    VideoDetails details
) {
    public Target {
        identifier = UsernameRules.normalize(identifier);
    }

    public static Target video(TargetOrigin origin, VideoDetails details) {
        return new Target(details == null ? null : details.author(), origin, null, details);
    }

    public static Target row(String username, TargetOrigin origin, String statusLabel) {
        return new Target(username, origin, statusLabel, null);
    }

    public boolean hasValidIdentifier() {
        return UsernameRules.isValid(identifier);
    }

    public boolean isFriendOrFollowing() {
        if (statusLabel == null) {
            return false;
        }
        String label = statusLabel.trim();
        return label.equalsIgnoreCase("Friends") || label.equalsIgnoreCase("Following");
    }
}
