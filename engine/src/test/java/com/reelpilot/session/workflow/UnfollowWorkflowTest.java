package com.reelpilot.session.workflow;

import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.navigation.ListKind;
import com.reelpilot.session.screen.UiElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UnfollowWorkflowTest {
    private WorkflowHarness harness;

    @BeforeEach
    void setUp() {
        harness = new WorkflowHarness();
        when(harness.navigator.openOwnList(ListKind.FOLLOWING)).thenReturn(true);
        harness.listOwnedByProfile(ListKind.FOLLOWING);
        when(harness.reader.visibleRows()).thenReturn(List.of(
            WorkflowHarness.row("carol", "Following", 400),
            WorkflowHarness.row("dave", "Friends", 600),
            WorkflowHarness.row("erin", "Follow", 800)
        ));
        when(harness.screen.tap(900, 400)).thenReturn(true);
        when(harness.screen.click(eq(UiElement.UNFOLLOW_CONFIRM), any(Duration.class))).thenReturn(true);
    }

    @Test
    void unfollowsFollowingRowsAndKeepsFriends() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.UNFOLLOW).maxUnfollows(5).build();

        Stats stats = new UnfollowWorkflow(harness.context(config)).run();

        assertEquals(1, stats.get(StatsCounter.UNFOLLOWED));
        assertEquals(1, stats.get(StatsCounter.ALREADY_FRIENDS));
        assertEquals(1, stats.get(StatsCounter.SKIPPED));
        assertEquals(CompletionReason.NO_MORE_TARGETS, stats.completionReason());
        verify(harness.screen, never()).tap(900, 600);
        verify(harness.ledgerStore).recordInteraction(eq("default"), eq("carol"), eq(InteractionKind.UNFOLLOW), eq(true), isNull());
        assertThat(harness.listener.actions).singleElement()
            .satisfies(action -> assertThat(action).containsEntry("action", "unfollow").containsEntry("target", "carol"));
    }

    @Test
    void stopsAtUnfollowLimit() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.UNFOLLOW).maxUnfollows(1).includeFriends(true).build();

        Stats stats = new UnfollowWorkflow(harness.context(config)).run();

        assertEquals(1, stats.get(StatsCounter.UNFOLLOWED));
        assertEquals(CompletionReason.MAX_UNFOLLOWS_REACHED, stats.completionReason());
        verify(harness.screen, never()).tap(900, 600);
    }

    @Test
    void listThatStopsScrollingIsRecoveredAndReopenedUntilScrollsRunOut() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.UNFOLLOW).stuckThreshold(3).build();
        when(harness.reader.visibleRows()).thenReturn(List.of(
            WorkflowHarness.row("erin", "Follow", 400),
            WorkflowHarness.row("frank", "Follow", 600)
        ));

        Stats stats = new UnfollowWorkflow(harness.context(config)).run();

        assertEquals(0, stats.get(StatsCounter.UNFOLLOWED));
        assertEquals(3, stats.get(StatsCounter.RECOVERIES));
        verify(harness.navigator, times(3)).openList(ListKind.FOLLOWING);
        verify(harness.screen, never()).restartApp();
        verify(harness.screen, times(6)).scrollList();
        assertEquals(CompletionReason.NO_MORE_TARGETS, stats.completionReason());
    }

    @Test
    void followingListThatCannotBeOpenedEndsWithNavigationFailed() {
        when(harness.navigator.openOwnList(ListKind.FOLLOWING)).thenReturn(false);
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.UNFOLLOW).build();

        Stats stats = new UnfollowWorkflow(harness.context(config)).run();

        assertEquals(CompletionReason.NAVIGATION_FAILED, stats.completionReason());
    }
}
