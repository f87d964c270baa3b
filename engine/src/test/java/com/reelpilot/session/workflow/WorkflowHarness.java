package com.reelpilot.session.workflow;

import com.reelpilot.session.action.ProbabilisticActionEngine;
import com.reelpilot.session.detect.PageDetector;
import com.reelpilot.session.event.EventPublisher;
import com.reelpilot.session.event.WorkflowEventListener;
import com.reelpilot.session.model.ListRow;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.VideoDetails;
import com.reelpilot.session.model.WorkflowType;
import com.reelpilot.session.navigation.ListKind;
import com.reelpilot.session.navigation.Navigator;
import com.reelpilot.session.pacing.PacingController;
import com.reelpilot.session.persistence.InteractionLedger;
import com.reelpilot.session.persistence.LedgerGuard;
import com.reelpilot.session.recovery.RecoverySupervisor;
import com.reelpilot.session.recovery.StuckDetector;
import com.reelpilot.session.screen.PopupDismisser;
import com.reelpilot.session.screen.ScreenActions;
import com.reelpilot.session.screen.ScreenReader;
import com.reelpilot.session.util.CountParser;
import com.reelpilot.session.util.Result;
import com.reelpilot.session.util.Sleeper;
import org.mockito.stubbing.Answer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Real engine, pacing, ledger guard, stuck detection and recovery over mocked device-facing
 * capabilities.
 */
class WorkflowHarness {
    final ScreenActions screen = mock(ScreenActions.class);
    final ScreenReader reader = mock(ScreenReader.class);
    final PageDetector detector = mock(PageDetector.class);
    final Navigator navigator = mock(Navigator.class);
    final PopupDismisser popups = mock(PopupDismisser.class);
    final InteractionLedger ledgerStore = mock(InteractionLedger.class);
    final RecordingListener listener = new RecordingListener();
    final Stats stats = new Stats();

    WorkflowHarness() {
        when(ledgerStore.hasRecentInteraction(any(), any(), any(), any())).thenReturn(Result.ok(false));
        when(ledgerStore.recordInteraction(any(), any(), any(), anyBoolean(), any())).thenReturn(Result.done());
        when(ledgerStore.countInteractionsForScope(any(), any(), any())).thenReturn(Result.ok(0));
    }

    WorkflowContext context(RunConfig config) {
        return context(config, SessionJournal.NONE);
    }

    WorkflowContext context(RunConfig config, SessionJournal journal) {
        EventPublisher events = new EventPublisher(List.of(listener));
        PacingController pacing = new PacingController(
            config.pauseAfterActions(),
            config.pauseDurationMin(),
            config.pauseDurationMax(),
            config.minDelay(),
            config.maxDelay(),
            new Random(7),
            Sleeper.NONE,
            events
        );
        LedgerGuard ledger = new LedgerGuard(ledgerStore, config.accountId(), Duration.ofHours(config.cooldownHours()), stats);
        return new WorkflowContext(
            config,
            stats,
            screen,
            reader,
            detector,
            navigator,
            popups,
            new ProbabilisticActionEngine(config, screen, ledger, pacing, events, new Random(7)),
            pacing,
            new StuckDetector(config.stuckThreshold()),
            new RecoverySupervisor(screen, popups, Sleeper.NONE, Duration.ZERO, stats),
            ledger,
            events,
            journal,
            Sleeper.NONE
        );
    }

    /**
     * The screen shows a user list until system back leaves it for the owning profile; reopening
     * {@code kind} from there brings the list back.
     */
    void listOwnedByProfile(ListKind kind) {
        AtomicBoolean onList = new AtomicBoolean(true);
        when(detector.classify()).thenAnswer(invocation -> onList.get() ? PageState.FOLLOWERS_LIST : PageState.PROFILE);
        when(screen.pressSystemBack()).thenAnswer(invocation -> {
            onList.set(false);
            return true;
        });
        when(navigator.openList(kind)).thenAnswer(invocation -> {
            onList.set(true);
            return true;
        });
    }

    /**
     * All actions disabled and no waiting; tests switch on what they exercise.
     */
    static RunConfig.Builder quietConfig(WorkflowType type) {
        return RunConfig.builder(type)
            .likeProbability(0)
            .followProbability(0)
            .favoriteProbability(0)
            .commentProbability(0)
            .shareProbability(0)
            .storyLikeProbability(0)
            .pauseAfterActions(0)
            .pauseDuration(0, 0)
            .delay(0, 0)
            .watchSeconds(0, 0)
            .seed(7L);
    }

    static VideoDetails video(String author, String likes) {
        return new VideoDetails(author, "clip by " + author, likes, CountParser.parse(likes), false, false, false);
    }

    static ListRow row(String username, String buttonLabel, int y) {
        return new ListRow(username, username.toUpperCase(), buttonLabel, 300, y, 900, y);
    }

    /**
     * Hands out {@code values} in order and keeps repeating the last one.
     */
    static <T> Answer<T> sequence(List<T> values) {
        AtomicInteger index = new AtomicInteger();
        return invocation -> values.get(Math.min(index.getAndIncrement(), values.size() - 1));
    }

    static class RecordingListener implements WorkflowEventListener {
        final List<Map<String, Object>> actions = new ArrayList<>();
        final List<Map<String, Object>> videos = new ArrayList<>();
        final List<Map<String, Object>> stats = new ArrayList<>();
        final List<Integer> pauses = new ArrayList<>();

        @Override
        public void onStats(Map<String, Object> stats) {
            this.stats.add(stats);
        }

        @Override
        public void onAction(Map<String, Object> action) {
            actions.add(action);
        }

        @Override
        public void onPause(int seconds) {
            pauses.add(seconds);
        }

        @Override
        public void onVideo(Map<String, Object> video) {
            videos.add(video);
        }
    }
}
