package com.reelpilot.session.workflow;

import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.ListRow;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.navigation.ListKind;
import com.reelpilot.session.recovery.Checkpoint;
import com.reelpilot.session.screen.UiElement;
import com.reelpilot.session.util.UsernameRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Unfollows accounts from the own Following list. Mutual follows ("Friends") are kept unless
 * {@code includeFriends} is set.
 */
public class UnfollowWorkflow extends AbstractWorkflow {
    private static final Logger log = LoggerFactory.getLogger(UnfollowWorkflow.class);

    static final int MAX_EMPTY_SCROLLS = 10;
    private static final Duration CONFIRM_TIMEOUT = Duration.ofSeconds(3);

    private final Set<String> processed = new HashSet<>();
    private final Checkpoint followingCheckpoint;
    private int emptyScrolls;

    public UnfollowWorkflow(WorkflowContext ctx) {
        super(ctx);
        this.followingCheckpoint = new Checkpoint(
            PageState.FOLLOWERS_LIST,
            "own following list",
            () -> ctx.navigator().openOwnList(ListKind.FOLLOWING)
        );
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.UNFOLLOW;
    }

    @Override
    protected void execute() {
        if (!ctx.navigator().openOwnList(ListKind.FOLLOWING)) {
            stats.complete(CompletionReason.NAVIGATION_FAILED);
            return;
        }
        while (shouldContinue()) {
            try {
                if (!iterate()) {
                    break;
                }
            } catch (RuntimeException e) {
                if (!recordFailure("unfollow iteration", e)) {
                    break;
                }
            }
        }
    }

    boolean iterate() {
        if (stats.get(StatsCounter.UNFOLLOWED) >= config.maxUnfollows()) {
            stats.complete(CompletionReason.MAX_UNFOLLOWS_REACHED);
            return false;
        }
        ctx.popups().dismissAll(stats);
        List<ListRow> rows = ctx.reader().visibleRows();

        Optional<ListRow> next = rows.stream().filter(row -> !processed.contains(row.username())).findFirst();
        if (next.isEmpty()) {
            emptyScrolls++;
            if (emptyScrolls >= MAX_EMPTY_SCROLLS) {
                log.info("No more accounts to unfollow after {} scrolls", emptyScrolls);
                stats.complete(CompletionReason.NO_MORE_TARGETS);
                return false;
            }
            StuckCheck stuck = checkStuck(
                FollowersWorkflow.signatureOf(rows),
                () -> rescanList(FollowersWorkflow::signatureOf),
                followingCheckpoint
            );
            if (stuck == StuckCheck.FAILED) {
                return false;
            }
            if (stuck == StuckCheck.RECOVERED) {
                return reenterList(ListKind.FOLLOWING, followingCheckpoint);
            }
            ctx.screen().scrollList();
            ctx.pacing().delayBetweenActions();
            return true;
        }
        emptyScrolls = 0;
        ctx.stuckDetector().reset();

        ListRow row = next.get();
        processed.add(row.username());
        if (!UsernameRules.isValid(row.username()) || !row.hasButton()) {
            stats.increment(StatsCounter.SKIPPED);
            return true;
        }
        String label = row.buttonLabel().trim();
        if (label.equalsIgnoreCase("Friends") && !config.includeFriends()) {
            stats.increment(StatsCounter.ALREADY_FRIENDS);
            return true;
        }
        if (!label.equalsIgnoreCase("Following") && !label.equalsIgnoreCase("Friends")) {
            stats.increment(StatsCounter.SKIPPED);
            return true;
        }

        boolean success = unfollow(row);
        ctx.ledger().record(row.username(), InteractionKind.UNFOLLOW, success, sessionId());
        ctx.events().action("unfollow", row.username(), success);
        if (success) {
            stats.increment(StatsCounter.UNFOLLOWED);
            ctx.pacing().noteAction();
        }
        ctx.pacing().delayBetweenActions();
        ctx.pacing().maybePause();
        return true;
    }

    private boolean unfollow(ListRow row) {
        if (!ctx.screen().tap(row.buttonX(), row.buttonY())) {
            return false;
        }
        if (ctx.screen().click(UiElement.UNFOLLOW_CONFIRM, CONFIRM_TIMEOUT)) {
            return true;
        }
        // some builds unfollow without a confirmation sheet
        return ctx.reader().visibleRows().stream()
            .filter(r -> row.username().equals(r.username()))
            .anyMatch(r -> r.buttonLabel() != null && r.buttonLabel().trim().equalsIgnoreCase("Follow"));
    }
}
