package com.reelpilot.session.model;

public enum PageState {
    FEED,
    PROFILE,
    FOLLOWERS_LIST,
    INBOX,
    STORY,
    VIDEO_PLAYER,
    SEARCH_RESULTS,
    UNKNOWN
}
