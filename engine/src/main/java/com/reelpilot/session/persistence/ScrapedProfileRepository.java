package com.reelpilot.session.persistence;

import com.reelpilot.session.model.ScrapedProfile;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class ScrapedProfileRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public ScrapedProfileRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = DatabaseDialect.isPostgres(jdbc);
    }

    public void upsert(long sessionId, ScrapedProfile profile) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId)
            .addValue("username", profile.username())
            .addValue("displayName", profile.displayName())
            .addValue("followersCount", profile.followersCount())
            .addValue("followingCount", profile.followingCount())
            .addValue("likesCount", profile.likesCount())
            .addValue("bio", profile.bio())
            .addValue("isPrivate", profile.privateAccount())
            .addValue("isVerified", profile.verified())
            .addValue("source", profile.source())
            .addValue("enriched", profile.enriched())
            .addValue("scrapedAt", Timestamp.from(profile.scrapedAt() == null ? Instant.now() : profile.scrapedAt()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO scraped_profiles (
                        session_id, username, display_name, followers_count, following_count, likes_count,
                        bio, is_private, is_verified, source, enriched, scraped_at
                    )
                    VALUES (
                        :sessionId, :username, :displayName, :followersCount, :followingCount, :likesCount,
                        :bio, :isPrivate, :isVerified, :source, :enriched, :scrapedAt
                    )
                    ON CONFLICT (session_id, username)
                    DO UPDATE SET
                        display_name = COALESCE(EXCLUDED.display_name, scraped_profiles.display_name),
                        followers_count = COALESCE(EXCLUDED.followers_count, scraped_profiles.followers_count),
                        following_count = COALESCE(EXCLUDED.following_count, scraped_profiles.following_count),
                        likes_count = COALESCE(EXCLUDED.likes_count, scraped_profiles.likes_count),
                        bio = COALESCE(EXCLUDED.bio, scraped_profiles.bio),
                        is_private = EXCLUDED.is_private,
                        is_verified = EXCLUDED.is_verified,
                        enriched = EXCLUDED.enriched OR scraped_profiles.enriched,
                        scraped_at = EXCLUDED.scraped_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO scraped_profiles (
                    session_id, username, display_name, followers_count, following_count, likes_count,
                    bio, is_private, is_verified, source, enriched, scraped_at
                )
                KEY(session_id, username)
                VALUES (
                    :sessionId, :username, :displayName, :followersCount, :followingCount, :likesCount,
                    :bio, :isPrivate, :isVerified, :source, :enriched, :scrapedAt
                )
                """,
            params
        );
    }

    public List<ScrapedProfile> findBySession(long sessionId) {
        return jdbc.query(
            """
                SELECT username, display_name, followers_count, following_count, likes_count,
                       bio, is_private, is_verified, source, enriched, scraped_at
                FROM scraped_profiles
                WHERE session_id = :sessionId
                ORDER BY id
                """,
            new MapSqlParameterSource("sessionId", sessionId),
            (rs, rowNum) -> {
                Timestamp scrapedAt = rs.getTimestamp("scraped_at");
                return new ScrapedProfile(
                    rs.getString("username"),
                    rs.getString("display_name"),
                    rs.getObject("followers_count", Long.class),
                    rs.getObject("following_count", Long.class),
                    rs.getObject("likes_count", Long.class),
                    rs.getString("bio"),
                    rs.getBoolean("is_private"),
                    rs.getBoolean("is_verified"),
                    rs.getString("source"),
                    rs.getBoolean("enriched"),
                    scrapedAt == null ? null : scrapedAt.toInstant()
                );
            }
        );
    }
}
