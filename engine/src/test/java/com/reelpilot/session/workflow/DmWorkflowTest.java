package com.reelpilot.session.workflow;

import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.InboxConversation;
import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.screen.UiElement;
import com.reelpilot.session.util.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DmWorkflowTest {
    private WorkflowHarness harness;

    @BeforeEach
    void setUp() {
        harness = new WorkflowHarness();
        when(harness.navigator.ensureFeed()).thenReturn(true);
        when(harness.navigator.openProfileOf(anyString())).thenReturn(true);
        when(harness.navigator.openInbox()).thenReturn(true);
        when(harness.navigator.returnTo(eq(PageState.INBOX), anyInt())).thenReturn(true);
        when(harness.screen.click(UiElement.PROFILE_MESSAGE_BUTTON)).thenReturn(true);
        when(harness.screen.click(UiElement.MESSAGE_INPUT)).thenReturn(true);
        when(harness.screen.click(UiElement.MESSAGE_SEND)).thenReturn(true);
        when(harness.screen.typeText(anyString())).thenReturn(true);
    }

    @Test
    void outreachMessagesEachRecipientOnceAndSkipsRecentOnes() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.DM)
            .targetUsernames(List.of("@Alice", "bob", "alice", "not a name!", "carol"))
            .messageTemplates(List.of("hey, loved your last video"))
            .build();
        when(harness.ledgerStore.hasRecentInteraction(any(), eq("bob"), eq(InteractionKind.DM), any())).thenReturn(Result.ok(true));
        when(harness.screen.isPresent(UiElement.MESSAGE_BLOCKED)).thenReturn(false, true);

        Stats stats = new DmWorkflow(harness.context(config)).run();

        assertEquals(1, stats.get(StatsCounter.MESSAGES_SENT));
        assertEquals(1, stats.get(StatsCounter.PRIVACY_BLOCKED));
        assertEquals(1, stats.get(StatsCounter.SKIPPED));
        assertEquals(CompletionReason.COMPLETED, stats.completionReason());
        verify(harness.navigator, never()).openProfileOf("bob");
        verify(harness.screen, times(1)).typeText("hey, loved your last video");
        verify(harness.ledgerStore).recordInteraction(eq("default"), eq("alice"), eq(InteractionKind.DM), eq(true), isNull());
        verify(harness.ledgerStore).recordInteraction(eq("default"), eq("carol"), eq(InteractionKind.DM), eq(false), isNull());
        verify(harness.navigator, times(2)).ensureFeed();
        assertThat(harness.listener.actions).extracting(action -> action.get("target")).containsExactly("alice", "carol");
    }

    @Test
    void outreachStopsAtConversationCap() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.DM)
            .targetUsernames(List.of("alice", "bob", "carol"))
            .messageTemplates(List.of("hi"))
            .maxConversations(2)
            .build();

        Stats stats = new DmWorkflow(harness.context(config)).run();

        assertEquals(2, stats.get(StatsCounter.MESSAGES_SENT));
        assertEquals(CompletionReason.MAX_CONVERSATIONS_REACHED, stats.completionReason());
        verify(harness.navigator, never()).openProfileOf("carol");
    }

    @Test
    void profileWithoutMessageButtonIsReportedAsFailedAction() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.DM)
            .targetUsernames(List.of("alice"))
            .messageTemplates(List.of("hi"))
            .build();
        when(harness.screen.click(UiElement.PROFILE_MESSAGE_BUTTON)).thenReturn(false);

        Stats stats = new DmWorkflow(harness.context(config)).run();

        assertEquals(0, stats.get(StatsCounter.MESSAGES_SENT));
        assertThat(harness.listener.actions).singleElement()
            .satisfies(action -> assertThat(action).containsEntry("action", "dm").containsEntry("success", false));
        verify(harness.screen, never()).typeText(anyString());
    }

    @Test
    void outreachWithoutTemplatesEndsWithError() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.DM).targetUsernames(List.of("alice")).build();

        Stats stats = new DmWorkflow(harness.context(config)).run();

        assertEquals(CompletionReason.ERROR, stats.completionReason());
        assertThat(stats.errorSummary()).contains("templates");
        verify(harness.navigator, never()).openProfileOf(any());
    }

    @Test
    void inboxReadSkipsSystemAndGroupThreadsUntilNothingNewAppears() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.DM).build();
        when(harness.reader.inboxConversations()).thenReturn(List.of(
            new InboxConversation("New followers", 300, 200),
            new InboxConversation("alice", 300, 400),
            new InboxConversation("Weekend crew", 300, 600)
        ));
        when(harness.screen.isPresent(UiElement.CONVERSATION_GROUP_MEMBERS)).thenReturn(false, true);

        Stats stats = new DmWorkflow(harness.context(config)).run();

        assertEquals(1, stats.get(StatsCounter.CONVERSATIONS_READ));
        assertEquals(1, stats.get(StatsCounter.GROUPS_SKIPPED));
        assertEquals(1, stats.get(StatsCounter.SKIPPED));
        assertEquals(0, stats.get(StatsCounter.MESSAGES_SENT));
        assertEquals(CompletionReason.NO_MORE_TARGETS, stats.completionReason());
        verify(harness.screen, never()).tap(300, 200);
        verify(harness.screen).tap(300, 400);
        verify(harness.screen).tap(300, 600);
        verify(harness.screen, times(DmWorkflow.EMPTY_INBOX_SCROLLS - 1)).scrollList();
        verify(harness.screen, never()).typeText(anyString());
    }

    @Test
    void inboxRepliesWithTemplateAndStopsAtConversationCap() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.DM)
            .messageTemplates(List.of("thanks for the follow"))
            .maxConversations(1)
            .build();
        when(harness.reader.inboxConversations()).thenReturn(List.of(
            new InboxConversation("alice", 300, 400),
            new InboxConversation("bob", 300, 600)
        ));

        Stats stats = new DmWorkflow(harness.context(config)).run();

        assertEquals(1, stats.get(StatsCounter.CONVERSATIONS_READ));
        assertEquals(1, stats.get(StatsCounter.MESSAGES_SENT));
        assertEquals(CompletionReason.MAX_CONVERSATIONS_REACHED, stats.completionReason());
        verify(harness.ledgerStore).recordInteraction(eq("default"), eq("alice"), eq(InteractionKind.DM), eq(true), isNull());
        verify(harness.screen, never()).tap(300, 600);
    }

    @Test
    void unreachableInboxThatSurvivesNoRestartEndsWithRecoveryFailed() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.DM).build();
        when(harness.navigator.openInbox()).thenReturn(false);
        when(harness.screen.restartApp()).thenReturn(false);

        Stats stats = new DmWorkflow(harness.context(config)).run();

        assertEquals(CompletionReason.RECOVERY_FAILED, stats.completionReason());
        verify(harness.reader, never()).inboxConversations();
    }
}
