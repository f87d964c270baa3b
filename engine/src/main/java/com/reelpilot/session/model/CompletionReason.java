package com.reelpilot.session.model;

import java.util.Locale;

public enum CompletionReason {
    COMPLETED,
    MAX_VIDEOS_REACHED,
    MAX_PROFILES_REACHED,
    MAX_LIKES_REACHED,
    MAX_FOLLOWS_REACHED,
    MAX_UNFOLLOWS_REACHED,
    MAX_CONVERSATIONS_REACHED,
    NO_MORE_TARGETS,
    STOPPED_BY_USER,
    NAVIGATION_FAILED,
    RECOVERY_FAILED,
    ERROR;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
