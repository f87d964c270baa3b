package com.reelpilot.session.workflow;

import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.model.TargetOrigin;
import com.reelpilot.session.model.VideoDetails;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.screen.UiElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SearchWorkflowTest {
    private WorkflowHarness harness;

    @BeforeEach
    void setUp() {
        harness = new WorkflowHarness();
        when(harness.screen.click(UiElement.LIKE_BUTTON)).thenReturn(true);
    }

    @Test
    void queryResultsAreWatchedAndLikedUntilTheLikeCap() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.SEARCH)
            .searchQuery(" latte art ")
            .likeProbability(1.0)
            .maxLikesPerSession(2)
            .maxTargets(10)
            .build();
        when(harness.navigator.openSearchVideos("latte art")).thenReturn(true);
        feed(WorkflowHarness.video("alice", "1K"), WorkflowHarness.video("bob", "20"), WorkflowHarness.video("carol", "3"));
        SearchWorkflow workflow = new SearchWorkflow(harness.context(config));

        Stats stats = workflow.run();

        assertEquals(TargetOrigin.SEARCH, workflow.origin());
        assertEquals(2, stats.get(StatsCounter.LIKED));
        assertEquals(CompletionReason.MAX_LIKES_REACHED, stats.completionReason());
        assertThat(harness.listener.videos).extracting(video -> video.get("author")).containsExactly("alice", "bob", "carol");
        assertThat(harness.listener.actions).extracting(action -> action.get("target")).containsExactly("alice", "bob");
        verify(harness.navigator).openSearchVideos("latte art");
        verify(harness.navigator, never()).ensureFeed();
    }

    @Test
    void hashtagWithoutQueryUsesTheHashtagGrid() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.SEARCH).hashtag("#cats").maxTargets(2).build();
        when(harness.navigator.openHashtag("cats")).thenReturn(true);
        feed(WorkflowHarness.video("alice", "1"), WorkflowHarness.video("bob", "2"), WorkflowHarness.video("carol", "3"));
        SearchWorkflow workflow = new SearchWorkflow(harness.context(config));

        Stats stats = workflow.run();

        assertEquals(TargetOrigin.HASHTAG, workflow.origin());
        assertEquals(2, stats.get(StatsCounter.WATCHED));
        assertEquals(CompletionReason.MAX_VIDEOS_REACHED, stats.completionReason());
        verify(harness.navigator).openHashtag("cats");
        verify(harness.navigator, never()).openSearchVideos(any());
    }

    @Test
    void queryWinsOverHashtagWhenBothAreSet() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.SEARCH).searchQuery("cats").hashtag("dogs").build();

        assertEquals(TargetOrigin.SEARCH, new SearchWorkflow(harness.context(config)).origin());
        assertEquals("search videos for 'cats'", SearchWorkflow.entryFor(harness.context(config)).description());
    }

    @Test
    void searchThatCannotBeOpenedIsRetriedAfterRestart() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.SEARCH).searchQuery("cats").maxTargets(1).build();
        when(harness.navigator.openSearchVideos("cats")).thenReturn(false, true);
        when(harness.screen.restartApp()).thenReturn(true);
        feed(WorkflowHarness.video("alice", "1"), WorkflowHarness.video("bob", "2"));

        Stats stats = new SearchWorkflow(harness.context(config)).run();

        assertEquals(1, stats.get(StatsCounter.RECOVERIES));
        assertEquals(1, stats.get(StatsCounter.WATCHED));
        assertEquals(CompletionReason.MAX_VIDEOS_REACHED, stats.completionReason());
        verify(harness.navigator, times(2)).openSearchVideos("cats");
    }

    @Test
    void missingQueryAndHashtagEndsWithError() {
        RunConfig config = WorkflowHarness.quietConfig(WorkflowType.SEARCH).searchQuery(" ").build();

        Stats stats = new SearchWorkflow(harness.context(config)).run();

        assertEquals(CompletionReason.ERROR, stats.completionReason());
        assertThat(stats.errorSummary()).contains("search query or hashtag");
        verify(harness.navigator, never()).openSearchVideos(any());
        verify(harness.reader, never()).readCurrentVideo();
    }

    private void feed(VideoDetails... videos) {
        List<Optional<VideoDetails>> reads = new ArrayList<>();
        for (VideoDetails video : videos) {
            reads.add(Optional.of(video));
        }
        when(harness.reader.readCurrentVideo()).thenAnswer(WorkflowHarness.sequence(reads));
    }
}
