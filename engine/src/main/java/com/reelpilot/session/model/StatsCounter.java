package com.reelpilot.session.model;

import java.util.Locale;

public enum StatsCounter {
    WATCHED,
    LIKED,
    FOLLOWED,
    FAVORITED,
    COMMENTED,
    SHARED,
    SKIPPED,
    ERRORS,
    POPUPS_CLOSED,
    ADS_SKIPPED,
    SUGGESTIONS_HANDLED,
    PROFILES_VISITED,
    FOLLOWERS_SEEN,
    ALREADY_FRIENDS,
    STORIES_LIKED,
    UNFOLLOWED,
    PROFILES_SCRAPED,
    PROFILES_ENRICHED,
    CONVERSATIONS_READ,
    MESSAGES_SENT,
    GROUPS_SKIPPED,
    PRIVACY_BLOCKED,
    RECOVERIES;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
