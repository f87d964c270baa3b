package com.reelpilot.session.model;

public enum TargetOrigin {
    FEED,
    FOLLOWERS_LIST,
    SEARCH,
    HASHTAG
}
