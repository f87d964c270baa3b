package com.reelpilot.session.model;

import java.time.Instant;

public record ScrapedProfile(
    String username,
    String displayName,
    Long followersCount,
    Long followingCount,
    Long likesCount,
    String bio,
    boolean privateAccount,
    boolean verified,
    String source,
    boolean enriched,
    Instant scrapedAt
) {
    public static ScrapedProfile fromRow(ListRow row, String source) {
        return new ScrapedProfile(row.username(), row.displayName(), null, null, null, null, false, false, source, false, Instant.now());
    }

    public ScrapedProfile enrichedWith(ProfileSnapshot snapshot) {
        if (snapshot == null) {
            return this;
        }
        return new ScrapedProfile(
            username,
            snapshot.displayName() != null ? snapshot.displayName() : displayName,
            snapshot.followersCount(),
            snapshot.followingCount(),
            snapshot.likesCount(),
            snapshot.bio(),
            snapshot.privateAccount(),
            snapshot.verified(),
            source,
            true,
            Instant.now()
        );
    }
}
