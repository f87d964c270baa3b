package com.reelpilot.session.api;

import java.util.List;

/**
 * Body of {@code POST /api/sessions/run}; every field except {@code workflow} falls back to the
 * configured defaults.
 */
public record SessionRunRequest(
    String workflow,
    String accountId,
    String searchQuery,
    List<String> targetUsernames,
    String hashtag,
    String scrapeSource,
    Boolean enrichProfiles,
    Integer maxTargets,
    Double likeProbability,
    Double followProbability,
    Double favoriteProbability,
    Double commentProbability,
    Double shareProbability,
    Double storyLikeProbability,
    Integer maxLikesPerSession,
    Integer maxFollowsPerSession,
    Integer maxUnfollows,
    Integer maxConversations,
    Integer postsPerProfile,
    Boolean includeFriends,
    Boolean followBackSuggestions,
    Long minLikes,
    Long maxLikes,
    List<String> requiredHashtags,
    List<String> excludedHashtags,
    List<String> commentTemplates,
    List<String> messageTemplates,
    Long seed
) {
}
