package com.reelpilot.session.action;

import java.util.Locale;

public enum SkipReason {
    INVALID_IDENTIFIER,
    ALREADY_LIKED,
    BELOW_MIN_LIKES,
    ABOVE_MAX_LIKES,
    EXCLUDED_TAG,
    MISSING_REQUIRED_TAG,
    FRIEND,
    RECENT_INTERACTION;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
