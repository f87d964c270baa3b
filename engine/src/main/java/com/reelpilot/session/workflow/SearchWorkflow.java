package com.reelpilot.session.workflow;

import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.TargetOrigin;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.recovery.Checkpoint;

/**
 * Works through the videos of a keyword search with the feed's watch, engage and pause loop.
 * With no query but a hashtag, the hashtag's video grid is used instead.
 */
public class SearchWorkflow extends FeedWorkflow {

    public SearchWorkflow(WorkflowContext ctx) {
        super(ctx, entryFor(ctx));
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.SEARCH;
    }

    @Override
    protected TargetOrigin origin() {
        return byHashtag(config) ? TargetOrigin.HASHTAG : TargetOrigin.SEARCH;
    }

    @Override
    protected void execute() {
        if (isBlank(config.searchQuery()) && isBlank(config.hashtag())) {
            stats.setErrorSummary("A search query or hashtag is required");
            stats.complete(CompletionReason.ERROR);
            return;
        }
        super.execute();
    }

    static Checkpoint entryFor(WorkflowContext ctx) {
        RunConfig config = ctx.config();
        if (byHashtag(config)) {
            String tag = config.hashtag().trim().replaceFirst("^#", "");
            return new Checkpoint(PageState.VIDEO_PLAYER, "videos of #" + tag, () -> ctx.navigator().openHashtag(tag));
        }
        String query = config.searchQuery() == null ? "" : config.searchQuery().trim();
        return new Checkpoint(PageState.VIDEO_PLAYER, "search videos for '" + query + "'", () -> ctx.navigator().openSearchVideos(query));
    }

    private static boolean byHashtag(RunConfig config) {
        return isBlank(config.searchQuery()) && !isBlank(config.hashtag());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
