package com.reelpilot.session.detect;

import com.reelpilot.session.model.PageState;
import com.reelpilot.session.screen.UiElement;

import java.util.List;

/**
 * Accepts {@code state} when at least {@code requiredMatches} markers are present and none of the
 * exclusions is.
 */
public record DetectionRule(
    PageState state,
    List<UiElement> markers,
    int requiredMatches,
    List<UiElement> exclusions
) {
    public DetectionRule {
        markers = List.copyOf(markers);
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
        requiredMatches = Math.max(1, Math.min(requiredMatches, markers.size()));
    }

    public static DetectionRule any(PageState state, UiElement... markers) {
        return new DetectionRule(state, List.of(markers), 1, List.of());
    }
}
