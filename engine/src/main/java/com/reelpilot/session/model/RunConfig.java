package com.reelpilot.session.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Immutable configuration of one workflow invocation. Probabilities are clamped to [0,1] and
 * ranges are reordered so that min never exceeds max.
 */
public record RunConfig(
    WorkflowType workflowType,
    String accountId,
    String searchQuery,
    List<String> targetUsernames,
    String hashtag,
    ScrapeSource scrapeSource,
    boolean enrichProfiles,
    int maxTargets,
    double likeProbability,
    double followProbability,
    double favoriteProbability,
    double commentProbability,
    double shareProbability,
    double storyLikeProbability,
    int maxLikesPerSession,
    int maxFollowsPerSession,
    int maxCommentsPerSession,
    int maxUnfollows,
    int maxConversations,
    int pauseAfterActions,
    double pauseDurationMin,
    double pauseDurationMax,
    double minDelay,
    double maxDelay,
    double minWatchSeconds,
    double maxWatchSeconds,
    int postsPerProfile,
    boolean skipAlreadyLiked,
    boolean includeFriends,
    boolean skipAds,
    boolean followBackSuggestions,
    Long minLikes,
    Long maxLikes,
    List<String> requiredHashtags,
    List<String> excludedHashtags,
    List<String> commentTemplates,
    List<String> messageTemplates,
    int cooldownHours,
    int stuckThreshold,
    int maxErrors,
    Long seed
) {
    public RunConfig {
        targetUsernames = List.copyOf(targetUsernames == null ? List.of() : targetUsernames);
        requiredHashtags = normalizeTags(requiredHashtags);
        excludedHashtags = normalizeTags(excludedHashtags);
        commentTemplates = List.copyOf(commentTemplates == null ? List.of() : commentTemplates);
        messageTemplates = List.copyOf(messageTemplates == null ? List.of() : messageTemplates);
        likeProbability = clampProbability(likeProbability);
        followProbability = clampProbability(followProbability);
        favoriteProbability = clampProbability(favoriteProbability);
        commentProbability = clampProbability(commentProbability);
        shareProbability = clampProbability(shareProbability);
        storyLikeProbability = clampProbability(storyLikeProbability);
        maxTargets = Math.max(0, maxTargets);
        maxLikesPerSession = Math.max(0, maxLikesPerSession);
        maxFollowsPerSession = Math.max(0, maxFollowsPerSession);
        maxCommentsPerSession = Math.max(0, maxCommentsPerSession);
        maxUnfollows = Math.max(0, maxUnfollows);
        maxConversations = Math.max(0, maxConversations);
        pauseDurationMin = Math.max(0, pauseDurationMin);
        pauseDurationMax = Math.max(pauseDurationMin, pauseDurationMax);
        minDelay = Math.max(0, minDelay);
        maxDelay = Math.max(minDelay, maxDelay);
        minWatchSeconds = Math.max(0, minWatchSeconds);
        maxWatchSeconds = Math.max(minWatchSeconds, maxWatchSeconds);
        postsPerProfile = Math.max(0, postsPerProfile);
        cooldownHours = Math.max(0, cooldownHours);
        stuckThreshold = Math.max(2, stuckThreshold);
        maxErrors = Math.max(1, maxErrors);
        scrapeSource = scrapeSource == null ? ScrapeSource.FOLLOWERS : scrapeSource;
    }

    public static Builder builder(WorkflowType workflowType) {
        return new Builder(workflowType);
    }

    public Builder toBuilder() {
        return new Builder(workflowType)
            .accountId(accountId)
            .searchQuery(searchQuery)
            .targetUsernames(targetUsernames)
            .hashtag(hashtag)
            .scrapeSource(scrapeSource)
            .enrichProfiles(enrichProfiles)
            .maxTargets(maxTargets)
            .likeProbability(likeProbability)
            .followProbability(followProbability)
            .favoriteProbability(favoriteProbability)
            .commentProbability(commentProbability)
            .shareProbability(shareProbability)
            .storyLikeProbability(storyLikeProbability)
            .maxLikesPerSession(maxLikesPerSession)
            .maxFollowsPerSession(maxFollowsPerSession)
            .maxCommentsPerSession(maxCommentsPerSession)
            .maxUnfollows(maxUnfollows)
            .maxConversations(maxConversations)
            .pauseAfterActions(pauseAfterActions)
            .pauseDuration(pauseDurationMin, pauseDurationMax)
            .delay(minDelay, maxDelay)
            .watchSeconds(minWatchSeconds, maxWatchSeconds)
            .postsPerProfile(postsPerProfile)
            .skipAlreadyLiked(skipAlreadyLiked)
            .includeFriends(includeFriends)
            .skipAds(skipAds)
            .followBackSuggestions(followBackSuggestions)
            .likeBounds(minLikes, maxLikes)
            .requiredHashtags(requiredHashtags)
            .excludedHashtags(excludedHashtags)
            .commentTemplates(commentTemplates)
            .messageTemplates(messageTemplates)
            .cooldownHours(cooldownHours)
            .stuckThreshold(stuckThreshold)
            .maxErrors(maxErrors)
            .seed(seed);
    }

    /**
     * Source account whose list is being worked; also the ledger scope for visited counts.
     */
    public String scope() {
        if (searchQuery != null && !searchQuery.isBlank()) {
            return searchQuery.trim().toLowerCase(Locale.ROOT).replaceFirst("^@", "");
        }
        if (hashtag != null && !hashtag.isBlank()) {
            return "#" + hashtag.trim().toLowerCase(Locale.ROOT).replaceFirst("^#", "");
        }
        return workflowType == null ? null : workflowType.name().toLowerCase(Locale.ROOT);
    }

    private static double clampProbability(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String tag : tags) {
            if (tag == null) {
                continue;
            }
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            if (normalized.startsWith("#")) {
                normalized = normalized.substring(1);
            }
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return List.copyOf(out);
    }

    public static final class Builder {
        private final WorkflowType workflowType;
        private String accountId = "default";
        private String searchQuery;
        private List<String> targetUsernames = List.of();
        private String hashtag;
        private ScrapeSource scrapeSource = ScrapeSource.FOLLOWERS;
        private boolean enrichProfiles;
        private int maxTargets = 50;
        private double likeProbability = 0.3;
        private double followProbability = 0.1;
        private double favoriteProbability = 0.05;
        private double commentProbability;
        private double shareProbability;
        private double storyLikeProbability = 0.5;
        private int maxLikesPerSession = 50;
        private int maxFollowsPerSession = 20;
        private int maxCommentsPerSession = 10;
        private int maxUnfollows = 50;
        private int maxConversations = 20;
        private int pauseAfterActions = 10;
        private double pauseDurationMin = 30;
        private double pauseDurationMax = 60;
        private double minDelay = 1;
        private double maxDelay = 3;
        private double minWatchSeconds = 2;
        private double maxWatchSeconds = 8;
        private int postsPerProfile = 2;
        private boolean skipAlreadyLiked = true;
        private boolean includeFriends;
        private boolean skipAds = true;
        private boolean followBackSuggestions;
        private Long minLikes;
        private Long maxLikes;
        private List<String> requiredHashtags = List.of();
        private List<String> excludedHashtags = List.of();
        private List<String> commentTemplates = List.of();
        private List<String> messageTemplates = List.of();
        private int cooldownHours = 168;
        private int stuckThreshold = 3;
        private int maxErrors = 5;
        private Long seed;

        private Builder(WorkflowType workflowType) {
            this.workflowType = workflowType;
        }

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder searchQuery(String searchQuery) {
            this.searchQuery = searchQuery;
            return this;
        }

        public Builder targetUsernames(List<String> targetUsernames) {
            this.targetUsernames = targetUsernames;
            return this;
        }

        public Builder hashtag(String hashtag) {
            this.hashtag = hashtag;
            return this;
        }

        public Builder scrapeSource(ScrapeSource scrapeSource) {
            this.scrapeSource = scrapeSource;
            return this;
        }

        public Builder enrichProfiles(boolean enrichProfiles) {
            this.enrichProfiles = enrichProfiles;
            return this;
        }

        public Builder maxTargets(int maxTargets) {
            this.maxTargets = maxTargets;
            return this;
        }

        public Builder likeProbability(double likeProbability) {
            this.likeProbability = likeProbability;
            return this;
        }

        public Builder followProbability(double followProbability) {
            this.followProbability = followProbability;
            return this;
        }

        public Builder favoriteProbability(double favoriteProbability) {
            this.favoriteProbability = favoriteProbability;
            return this;
        }

        public Builder commentProbability(double commentProbability) {
            this.commentProbability = commentProbability;
            return this;
        }

        public Builder shareProbability(double shareProbability) {
            this.shareProbability = shareProbability;
            return this;
        }

        public Builder storyLikeProbability(double storyLikeProbability) {
            this.storyLikeProbability = storyLikeProbability;
            return this;
        }

        public Builder maxLikesPerSession(int maxLikesPerSession) {
            this.maxLikesPerSession = maxLikesPerSession;
            return this;
        }

        public Builder maxFollowsPerSession(int maxFollowsPerSession) {
            this.maxFollowsPerSession = maxFollowsPerSession;
            return this;
        }

        public Builder maxCommentsPerSession(int maxCommentsPerSession) {
            this.maxCommentsPerSession = maxCommentsPerSession;
            return this;
        }

        public Builder maxUnfollows(int maxUnfollows) {
            this.maxUnfollows = maxUnfollows;
            return this;
        }

        public Builder maxConversations(int maxConversations) {
            this.maxConversations = maxConversations;
            return this;
        }

        public Builder pauseAfterActions(int pauseAfterActions) {
            this.pauseAfterActions = pauseAfterActions;
            return this;
        }

        public Builder pauseDuration(double min, double max) {
            this.pauseDurationMin = min;
            this.pauseDurationMax = max;
            return this;
        }

        public Builder delay(double min, double max) {
            this.minDelay = min;
            this.maxDelay = max;
            return this;
        }

        public Builder watchSeconds(double min, double max) {
            this.minWatchSeconds = min;
            this.maxWatchSeconds = max;
            return this;
        }

        public Builder postsPerProfile(int postsPerProfile) {
            this.postsPerProfile = postsPerProfile;
            return this;
        }

        public Builder skipAlreadyLiked(boolean skipAlreadyLiked) {
            this.skipAlreadyLiked = skipAlreadyLiked;
            return this;
        }

        public Builder includeFriends(boolean includeFriends) {
            this.includeFriends = includeFriends;
            return this;
        }

        public Builder skipAds(boolean skipAds) {
            this.skipAds = skipAds;
            return this;
        }

        public Builder followBackSuggestions(boolean followBackSuggestions) {
            this.followBackSuggestions = followBackSuggestions;
            return this;
        }

        public Builder likeBounds(Long minLikes, Long maxLikes) {
            this.minLikes = minLikes;
            this.maxLikes = maxLikes;
            return this;
        }

        public Builder requiredHashtags(List<String> requiredHashtags) {
            this.requiredHashtags = requiredHashtags;
            return this;
        }

        public Builder excludedHashtags(List<String> excludedHashtags) {
            this.excludedHashtags = excludedHashtags;
            return this;
        }

        public Builder commentTemplates(List<String> commentTemplates) {
            this.commentTemplates = commentTemplates;
            return this;
        }

        public Builder messageTemplates(List<String> messageTemplates) {
            this.messageTemplates = messageTemplates;
            return this;
        }

        public Builder cooldownHours(int cooldownHours) {
            this.cooldownHours = cooldownHours;
            return this;
        }

        public Builder stuckThreshold(int stuckThreshold) {
            this.stuckThreshold = stuckThreshold;
            return this;
        }

        public Builder maxErrors(int maxErrors) {
            this.maxErrors = maxErrors;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public RunConfig build() {
            return new RunConfig(
                workflowType,
                accountId,
                searchQuery,
                targetUsernames,
                hashtag,
                scrapeSource,
                enrichProfiles,
                maxTargets,
                likeProbability,
                followProbability,
                favoriteProbability,
                commentProbability,
                shareProbability,
                storyLikeProbability,
                maxLikesPerSession,
                maxFollowsPerSession,
                maxCommentsPerSession,
                maxUnfollows,
                maxConversations,
                pauseAfterActions,
                pauseDurationMin,
                pauseDurationMax,
                minDelay,
                maxDelay,
                minWatchSeconds,
                maxWatchSeconds,
                postsPerProfile,
                skipAlreadyLiked,
                includeFriends,
                skipAds,
                followBackSuggestions,
                minLikes,
                maxLikes,
                requiredHashtags,
                excludedHashtags,
                commentTemplates,
                messageTemplates,
                cooldownHours,
                stuckThreshold,
                maxErrors,
                seed
            );
        }
    }
}
