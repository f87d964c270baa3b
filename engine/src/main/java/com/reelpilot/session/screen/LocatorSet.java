package com.reelpilot.session.screen;

import java.util.List;

/**
 * Named list of alternative XPath expressions for one UI element, tried in order.
 */
public record LocatorSet(
    String name,
    List<String> xpaths
) {
    public LocatorSet {
        xpaths = xpaths == null ? List.of() : List.copyOf(xpaths);
    }

    public boolean isEmpty() {
        return xpaths.isEmpty();
    }
}
