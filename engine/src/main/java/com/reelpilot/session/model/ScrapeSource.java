package com.reelpilot.session.model;

import java.util.Locale;

public enum ScrapeSource {
    FOLLOWERS,
    FOLLOWING,
    HASHTAG;

    public static ScrapeSource fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FOLLOWERS;
        }
        return ScrapeSource.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
