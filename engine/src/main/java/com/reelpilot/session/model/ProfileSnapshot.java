package com.reelpilot.session.model;

public record ProfileSnapshot(
    String username,
    String displayName,
    Long followersCount,
    Long followingCount,
    Long likesCount,
    String bio,
    boolean privateAccount,
    boolean verified,
    boolean followed
) {
}
