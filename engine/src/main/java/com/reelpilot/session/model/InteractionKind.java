package com.reelpilot.session.model;

public enum InteractionKind {
    LIKE,
    FOLLOW,
    FAVORITE,
    COMMENT,
    SHARE,
    PROFILE_VISIT,
    UNFOLLOW,
    DM;

    public String code() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
