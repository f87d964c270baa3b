package com.reelpilot.session.workflow;

import com.reelpilot.session.action.ActionContext;
import com.reelpilot.session.action.SkipReason;
import com.reelpilot.session.action.Surface;
import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.ListRow;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.ScreenSignature;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.model.Target;
import com.reelpilot.session.model.TargetOrigin;
import com.reelpilot.session.model.VideoDetails;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.navigation.ListKind;
import com.reelpilot.session.recovery.Checkpoint;
import com.reelpilot.session.recovery.SmartScrollBudget;
import com.reelpilot.session.screen.UiElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks the followers list of a source account: opens each follower's profile, engages with a
 * few of their posts and optionally follows them.
 */
public class FollowersWorkflow extends AbstractWorkflow {
    private static final Logger log = LoggerFactory.getLogger(FollowersWorkflow.class);

    static final int EMPTY_READS_BEFORE_PAGE_CHECK = 3;
    static final int RETURN_ATTEMPTS = 5;
    private static final Duration SETTLE = Duration.ofMillis(1500);

    private final Set<String> processed = new HashSet<>();
    private Checkpoint listCheckpoint;
    private Long totalFollowers;
    private int scrollBudget;
    private int unproductiveScrolls;
    private int emptyReads;

    public FollowersWorkflow(WorkflowContext ctx) {
        super(ctx);
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.FOLLOWERS;
    }

    @Override
    protected void execute() {
        String source = config.searchQuery();
        if (source == null || source.isBlank()) {
            stats.setErrorSummary("A source account is required");
            stats.complete(CompletionReason.ERROR);
            return;
        }
        listCheckpoint = new Checkpoint(
            PageState.FOLLOWERS_LIST,
            "followers of @" + source,
            () -> ctx.navigator().openListOf(source, ListKind.FOLLOWERS)
        );

        if (!ctx.navigator().openProfileOf(source)) {
            log.warn("Could not open profile of @{}", source);
            stats.complete(CompletionReason.NAVIGATION_FAILED);
            return;
        }
        totalFollowers = ctx.reader().readFollowersCount();
        if (!ctx.navigator().openList(ListKind.FOLLOWERS)) {
            log.warn("Could not open followers list of @{}", source);
            stats.complete(CompletionReason.NAVIGATION_FAILED);
            return;
        }
        recomputeScrollBudget();

        while (shouldContinue()) {
            try {
                if (!iterate()) {
                    break;
                }
            } catch (RuntimeException e) {
                if (!recordFailure("followers iteration", e) || !returnToList()) {
                    break;
                }
            }
        }
    }

    /**
     * @return false when the loop must end
     */
    boolean iterate() {
        if (stats.get(StatsCounter.PROFILES_VISITED) >= config.maxTargets()) {
            stats.complete(CompletionReason.MAX_PROFILES_REACHED);
            return false;
        }
        if (sessionCapReached()) {
            return false;
        }
        ctx.popups().dismissAll(stats);

        List<ListRow> rows = ctx.reader().visibleRows();
        if (rows.isEmpty()) {
            return handleEmptyList();
        }
        emptyReads = 0;

        Optional<ListRow> next = rows.stream().filter(row -> !processed.contains(row.username())).findFirst();
        if (next.isEmpty()) {
            unproductiveScrolls++;
            if (unproductiveScrolls > scrollBudget) {
                log.info("No new followers after {} scrolls, list exhausted", unproductiveScrolls - 1);
                stats.complete(CompletionReason.NO_MORE_TARGETS);
                return false;
            }
            StuckCheck stuck = checkStuck(signatureOf(rows), this::rescan, listCheckpoint);
            if (stuck == StuckCheck.FAILED) {
                return false;
            }
            if (stuck == StuckCheck.RECOVERED) {
                if (!reenterList(ListKind.FOLLOWERS, listCheckpoint)) {
                    return false;
                }
                recomputeScrollBudget();
                return true;
            }
            ctx.screen().scrollList();
            ctx.sleeper().sleep(SETTLE);
            return true;
        }
        unproductiveScrolls = 0;
        ctx.stuckDetector().reset();

        ListRow row = next.get();
        processed.add(row.username());
        stats.increment(StatsCounter.FOLLOWERS_SEEN);
        Target target = row.toTarget(TargetOrigin.FOLLOWERS_LIST);
        Optional<SkipReason> skip = ctx.engine().screen(target, profileContext());
        if (skip.isPresent()) {
            log.debug("Skipping @{}: {}", row.username(), skip.get().code());
            stats.increment(skip.get() == SkipReason.FRIEND ? StatsCounter.ALREADY_FRIENDS : StatsCounter.SKIPPED);
            return true;
        }

        visitProfile(row, target);
        ctx.pacing().maybePause();
        return returnToList();
    }

    private void visitProfile(ListRow row, Target target) {
        ctx.screen().tap(row.centerX(), row.centerY());
        ctx.sleeper().sleep(SETTLE);
        PageState landed = ctx.detector().classify();
        if (landed == PageState.STORY) {
            handleStory(target);
            landed = ctx.detector().classify();
        }
        if (landed != PageState.PROFILE) {
            log.info("Opening @{} landed on {}", row.username(), landed);
            return;
        }
        stats.increment(StatsCounter.PROFILES_VISITED);
        ctx.ledger().record(row.username(), InteractionKind.PROFILE_VISIT, true, sessionId());

        boolean privateAccount = ctx.screen().isPresent(UiElement.PROFILE_PRIVATE_NOTICE);
        if (!privateAccount) {
            engageWithPosts(target);
        }
        ctx.engine().decideAndExecute(
            target,
            profileContext().withSurface(Surface.PROFILE, EnumSet.of(InteractionKind.FOLLOW)).withoutLedger()
        );
    }

    private void engageWithPosts(Target profile) {
        int posts = Math.min(config.postsPerProfile(), ctx.reader().countVisiblePosts());
        if (posts <= 0 || !ctx.navigator().openProfileGridItem(0)) {
            return;
        }
        ActionContext postContext = ActionContext.video(stats, sessionId())
            .withSurface(Surface.VIDEO, EnumSet.of(InteractionKind.LIKE, InteractionKind.FAVORITE, InteractionKind.COMMENT, InteractionKind.SHARE))
            .withoutLedger();
        for (int i = 0; i < posts && !isStopRequested(); i++) {
            VideoDetails video = ctx.reader().readCurrentVideo().orElse(null);
            Target post = new Target(profile.identifier(), TargetOrigin.FOLLOWERS_LIST, profile.statusLabel(), video);
            if (video != null) {
                ctx.events().video(Map.of("author", profile.identifier(), "likes", String.valueOf(video.likeCountText())));
            }
            ctx.pacing().hold(config.minWatchSeconds(), config.maxWatchSeconds());
            stats.increment(StatsCounter.WATCHED);
            if (video != null) {
                ctx.engine().decideAndExecute(post, postContext);
            }
            if (i < posts - 1) {
                ctx.screen().swipeToNextVideo();
            }
        }
        ctx.screen().back();
        ctx.sleeper().sleep(SETTLE);
    }

    private void handleStory(Target target) {
        log.debug("@{} opened as a story", target.identifier());
        ctx.engine().decideAndExecute(
            target,
            profileContext().withSurface(Surface.STORY, EnumSet.of(InteractionKind.LIKE)).withoutLedger()
        );
        if (!ctx.screen().click(UiElement.STORY_CLOSE)) {
            ctx.screen().pressSystemBack();
        }
        ctx.sleeper().sleep(SETTLE);
    }

    private boolean handleEmptyList() {
        emptyReads++;
        if (emptyReads < EMPTY_READS_BEFORE_PAGE_CHECK) {
            ctx.screen().scrollList();
            ctx.sleeper().sleep(SETTLE);
            return true;
        }
        emptyReads = 0;
        PageState state = ctx.detector().classify();
        log.info("No rows after {} reads, screen is {}", EMPTY_READS_BEFORE_PAGE_CHECK, state);
        return returnToList();
    }

    /**
     * Back navigation first; when that does not land on the list, restart and resume from the
     * checkpoint with a freshly estimated scroll budget.
     */
    private boolean returnToList() {
        if (ctx.navigator().returnTo(PageState.FOLLOWERS_LIST, RETURN_ATTEMPTS)) {
            return true;
        }
        if (!hardRecover(listCheckpoint)) {
            return false;
        }
        recomputeScrollBudget();
        return true;
    }

    private void recomputeScrollBudget() {
        int visited = Math.max(ctx.ledger().countForScope(config.scope()), processed.size());
        scrollBudget = SmartScrollBudget.attempts(visited, totalFollowers);
        log.info("Scroll budget {} ({} visited of {})", scrollBudget, visited, totalFollowers);
    }

    private ScreenSignature rescan() {
        return rescanList(FollowersWorkflow::signatureOf);
    }

    /**
     * Visible usernames only; a scroll that does not move the list repeats the same signature.
     */
    static ScreenSignature signatureOf(List<ListRow> rows) {
        String visible = rows.stream().map(ListRow::username).collect(Collectors.joining(","));
        return new ScreenSignature(PageState.FOLLOWERS_LIST, visible);
    }

    private ActionContext profileContext() {
        return new ActionContext(stats, Surface.PROFILE, EnumSet.of(InteractionKind.FOLLOW), true, sessionId());
    }
}
