package com.reelpilot.session.workflow;

import com.reelpilot.session.action.ActionContext;
import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.ScreenSignature;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.model.Target;
import com.reelpilot.session.model.TargetOrigin;
import com.reelpilot.session.model.VideoDetails;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.recovery.Checkpoint;
import com.reelpilot.session.screen.UiElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scrolls the For You feed, watching each video and deciding the engagement actions for it.
 */
public class FeedWorkflow extends AbstractWorkflow {
    private static final Logger log = LoggerFactory.getLogger(FeedWorkflow.class);

    private final Checkpoint entry;
    private int unreadableInARow;

    public FeedWorkflow(WorkflowContext ctx) {
        this(ctx, new Checkpoint(PageState.FEED, "for you feed", ctx.navigator()::ensureFeed));
    }

    /**
     * @param entry where the video loop starts; also the hard recovery target
     */
    protected FeedWorkflow(WorkflowContext ctx, Checkpoint entry) {
        super(ctx);
        this.entry = entry;
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.FEED;
    }

    protected TargetOrigin origin() {
        return TargetOrigin.FEED;
    }

    @Override
    protected void execute() {
        if (!entry.reach().getAsBoolean() && !hardRecover(entry)) {
            stats.complete(CompletionReason.NAVIGATION_FAILED);
            return;
        }
        while (shouldContinue()) {
            try {
                if (!iterate()) {
                    break;
                }
            } catch (RuntimeException e) {
                if (!recordFailure("feed iteration", e)) {
                    break;
                }
                ctx.screen().swipeToNextVideo();
            }
        }
    }

    /**
     * @return false when the loop must end
     */
    boolean iterate() {
        ctx.popups().dismissAll(stats);
        if (handleInterruption()) {
            return true;
        }

        Optional<VideoDetails> current = ctx.reader().readCurrentVideo();
        if (current.isEmpty()) {
            return handleUnreadable();
        }
        unreadableInARow = 0;
        VideoDetails video = current.get();
        Target target = Target.video(origin(), video);
        ctx.events().video(describe(video));

        if (sessionCapReached()) {
            return false;
        }
        if (stats.get(StatsCounter.WATCHED) >= config.maxTargets()) {
            stats.complete(CompletionReason.MAX_VIDEOS_REACHED);
            return false;
        }

        StuckCheck stuck = checkStuck(signatureOf(video), this::rescan, entry);
        if (stuck == StuckCheck.FAILED) {
            return false;
        }
        if (stuck == StuckCheck.RECOVERED) {
            return true;
        }

        if (video.advertisement() && config.skipAds()) {
            log.debug("Skipping ad from {}", video.author());
            stats.increment(StatsCounter.ADS_SKIPPED);
            ctx.screen().swipeToNextVideo();
            return true;
        }

        ctx.pacing().hold(config.minWatchSeconds(), config.maxWatchSeconds());
        stats.increment(StatsCounter.WATCHED);
        ctx.engine().decideAndExecute(target, ActionContext.video(stats, sessionId()));
        ctx.pacing().maybePause();
        ctx.screen().swipeToNextVideo();
        return true;
    }

    /**
     * Suggested-accounts page and an accidentally opened comments sheet both replace the video.
     */
    private boolean handleInterruption() {
        if (ctx.screen().isPresent(UiElement.SUGGESTION_PAGE)) {
            stats.increment(StatsCounter.SUGGESTIONS_HANDLED);
            boolean followAllowed = config.followBackSuggestions()
                && stats.get(StatsCounter.FOLLOWED) < config.maxFollowsPerSession();
            if (followAllowed && ctx.screen().click(UiElement.SUGGESTION_FOLLOW_BACK)) {
                stats.increment(StatsCounter.FOLLOWED);
                ctx.pacing().noteAction();
                ctx.events().action("follow_back", null, true);
            } else if (!ctx.screen().clickFirst(UiElement.SUGGESTION_NOT_INTERESTED, UiElement.SUGGESTION_CLOSE)) {
                ctx.screen().swipeToNextVideo();
            }
            return true;
        }
        if (ctx.screen().isPresent(UiElement.COMMENTS_SECTION)) {
            if (!ctx.screen().click(UiElement.COMMENTS_CLOSE)) {
                ctx.screen().pressSystemBack();
            }
            stats.increment(StatsCounter.POPUPS_CLOSED);
            return true;
        }
        return false;
    }

    private boolean handleUnreadable() {
        unreadableInARow++;
        if (unreadableInARow < config.stuckThreshold()) {
            PageState state = ctx.detector().classify();
            if (state != PageState.FEED && state != PageState.VIDEO_PLAYER) {
                log.info("Left the video pager (now {}), returning to {}", state, entry.description());
                entry.reach().getAsBoolean();
            } else {
                ctx.screen().swipeToNextVideo();
            }
            return true;
        }
        log.warn("No readable video after {} attempts, restarting", unreadableInARow);
        unreadableInARow = 0;
        return hardRecover(entry);
    }

    private ScreenSignature rescan() {
        return ctx.reader().readCurrentVideo().map(FeedWorkflow::signatureOf).orElse(null);
    }

    static ScreenSignature signatureOf(VideoDetails video) {
        if (video.author() == null) {
            return new ScreenSignature(PageState.FEED, null);
        }
        String likes = video.likeCountText() == null ? "" : video.likeCountText();
        return new ScreenSignature(PageState.FEED, video.author() + "_" + likes);
    }

    private static Map<String, Object> describe(VideoDetails video) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("author", video.author());
        data.put("description", video.description());
        data.put("likes", video.likeCountText());
        data.put("liked", video.liked());
        data.put("ad", video.advertisement());
        return data;
    }
}
