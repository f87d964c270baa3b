package com.reelpilot.session.action;

import com.reelpilot.session.event.EventPublisher;
import com.reelpilot.session.model.ActionOutcome;
import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.model.Target;
import com.reelpilot.session.model.VideoDetails;
import com.reelpilot.session.pacing.PacingController;
import com.reelpilot.session.persistence.LedgerGuard;
import com.reelpilot.session.screen.ScreenActions;
import com.reelpilot.session.screen.UiElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Per-target action selection. Kinds are evaluated in a fixed order; for each one the session cap
 * is checked first, then an independent draw against its probability, then whether the target is
 * already in that state. Counters only move when the UI action reports success.
 */
public class ProbabilisticActionEngine implements ActionEngine {
    private static final Logger log = LoggerFactory.getLogger(ProbabilisticActionEngine.class);

    public static final List<InteractionKind> ORDER = List.of(
        InteractionKind.LIKE,
        InteractionKind.FOLLOW,
        InteractionKind.FAVORITE,
        InteractionKind.COMMENT,
        InteractionKind.SHARE
    );
    private static final Set<InteractionKind> LEDGER_KINDS = Set.of(InteractionKind.LIKE, InteractionKind.FOLLOW);

    private final RunConfig config;
    private final ScreenActions screen;
    private final LedgerGuard ledger;
    private final PacingController pacing;
    private final EventPublisher events;
    private final Random random;

    public ProbabilisticActionEngine(
        RunConfig config,
        ScreenActions screen,
        LedgerGuard ledger,
        PacingController pacing,
        EventPublisher events,
        Random random
    ) {
        this.config = config;
        this.screen = screen;
        this.ledger = ledger;
        this.pacing = pacing;
        this.events = events;
        this.random = random;
    }

    @Override
    public Optional<SkipReason> screen(Target target, ActionContext context) {
        if (target == null || !target.hasValidIdentifier()) {
            return Optional.of(SkipReason.INVALID_IDENTIFIER);
        }
        VideoDetails details = target.details();
        if (details != null) {
            if (config.skipAlreadyLiked() && details.liked()) {
                return Optional.of(SkipReason.ALREADY_LIKED);
            }
            if (config.minLikes() != null && details.likeCount() != null && details.likeCount() < config.minLikes()) {
                return Optional.of(SkipReason.BELOW_MIN_LIKES);
            }
            if (config.maxLikes() != null && details.likeCount() != null && details.likeCount() > config.maxLikes()) {
                return Optional.of(SkipReason.ABOVE_MAX_LIKES);
            }
            Set<String> tags = details.hashtags();
            for (String excluded : config.excludedHashtags()) {
                if (tags.contains(excluded)) {
                    return Optional.of(SkipReason.EXCLUDED_TAG);
                }
            }
            if (!config.requiredHashtags().isEmpty() && config.requiredHashtags().stream().noneMatch(tags::contains)) {
                return Optional.of(SkipReason.MISSING_REQUIRED_TAG);
            }
        }
        if (!config.includeFriends() && target.isFriendOrFollowing()) {
            return Optional.of(SkipReason.FRIEND);
        }
        if (context.consultLedger() && ledger.hasRecent(target.identifier(), null)) {
            return Optional.of(SkipReason.RECENT_INTERACTION);
        }
        return Optional.empty();
    }

    @Override
    public ActionOutcome decideAndExecute(Target target, ActionContext context) {
        Stats stats = context.stats();
        Optional<SkipReason> skip = screen(target, context);
        if (skip.isPresent()) {
            log.debug("Skipping {}: {}", target == null ? null : target.identifier(), skip.get().code());
            stats.increment(StatsCounter.SKIPPED);
            return ActionOutcome.skipped(skip.get().code());
        }

        EnumMap<InteractionKind, Boolean> attempts = new EnumMap<>(InteractionKind.class);
        for (InteractionKind kind : ORDER) {
            if (!context.kinds().contains(kind)) {
                continue;
            }
            if (stats.get(counterFor(kind)) >= capFor(kind)) {
                continue;
            }
            double probability = probabilityFor(kind, context.surface());
            if (!(random.nextDouble() < probability)) {
                continue;
            }
            if (alreadyDone(kind, target, context.surface())) {
                continue;
            }
            boolean success = perform(kind, context.surface());
            attempts.put(kind, success);
            if (success) {
                stats.increment(counterFor(kind));
                if (kind == InteractionKind.LIKE && context.surface() == Surface.STORY) {
                    stats.increment(StatsCounter.STORIES_LIKED);
                }
                pacing.noteAction();
            }
            if (LEDGER_KINDS.contains(kind)) {
                ledger.record(target.identifier(), kind, success, context.sessionId());
            }
            events.action(kind.code(), target.identifier(), success);
            log.debug("{} on {} via {}: {}", kind, target.identifier(), context.surface(), success ? "ok" : "failed");
            pacing.delayBetweenActions();
        }
        return ActionOutcome.of(attempts);
    }

    int capFor(InteractionKind kind) {
        return switch (kind) {
            case LIKE -> config.maxLikesPerSession();
            case FOLLOW -> config.maxFollowsPerSession();
            case COMMENT -> config.maxCommentsPerSession();
            default -> Integer.MAX_VALUE;
        };
    }

    static StatsCounter counterFor(InteractionKind kind) {
        return switch (kind) {
            case LIKE -> StatsCounter.LIKED;
            case FOLLOW -> StatsCounter.FOLLOWED;
            case FAVORITE -> StatsCounter.FAVORITED;
            case COMMENT -> StatsCounter.COMMENTED;
            case SHARE -> StatsCounter.SHARED;
            case UNFOLLOW -> StatsCounter.UNFOLLOWED;
            case PROFILE_VISIT -> StatsCounter.PROFILES_VISITED;
            case DM -> StatsCounter.MESSAGES_SENT;
        };
    }

    private double probabilityFor(InteractionKind kind, Surface surface) {
        if (surface == Surface.STORY) {
            return kind == InteractionKind.LIKE ? config.storyLikeProbability() : 0.0;
        }
        if (surface == Surface.PROFILE) {
            return kind == InteractionKind.FOLLOW ? config.followProbability() : 0.0;
        }
        return switch (kind) {
            case LIKE -> config.likeProbability();
            case FOLLOW -> config.followProbability();
            case FAVORITE -> config.favoriteProbability();
            case COMMENT -> config.commentTemplates().isEmpty() ? 0.0 : config.commentProbability();
            case SHARE -> config.shareProbability();
            default -> 0.0;
        };
    }

    private boolean alreadyDone(InteractionKind kind, Target target, Surface surface) {
        VideoDetails details = target.details();
        return switch (kind) {
            case LIKE -> details != null && details.liked();
            case FAVORITE -> details != null && details.favorited();
            case FOLLOW -> target.isFriendOrFollowing()
                || (surface == Surface.PROFILE && screen.isPresent(UiElement.PROFILE_FOLLOWING_BUTTON));
            default -> false;
        };
    }

    private boolean perform(InteractionKind kind, Surface surface) {
        return switch (kind) {
            case LIKE -> screen.click(surface == Surface.STORY ? UiElement.STORY_LIKE_BUTTON : UiElement.LIKE_BUTTON);
            case FOLLOW -> screen.click(surface == Surface.PROFILE ? UiElement.PROFILE_FOLLOW_BUTTON : UiElement.VIDEO_FOLLOW_BUTTON);
            case FAVORITE -> screen.click(UiElement.FAVORITE_BUTTON);
            case COMMENT -> postComment();
            case SHARE -> copyLink();
            default -> false;
        };
    }

    private boolean postComment() {
        List<String> templates = config.commentTemplates();
        if (templates.isEmpty() || !screen.click(UiElement.COMMENT_BUTTON)) {
            return false;
        }
        String text = templates.get(random.nextInt(templates.size()));
        boolean posted = screen.click(UiElement.COMMENT_INPUT)
            && screen.typeText(text)
            && screen.click(UiElement.COMMENT_SEND);
        if (!screen.click(UiElement.COMMENTS_CLOSE)) {
            screen.pressSystemBack();
        }
        return posted;
    }

    private boolean copyLink() {
        if (!screen.click(UiElement.SHARE_BUTTON)) {
            return false;
        }
        if (screen.click(UiElement.SHARE_COPY_LINK)) {
            return true;
        }
        screen.pressSystemBack();
        return false;
    }
}
