package com.reelpilot.session.pacing;

import com.reelpilot.session.event.EventPublisher;
import com.reelpilot.session.event.WorkflowEventListener;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PacingControllerTest {
    private final List<Duration> sleeps = new ArrayList<>();
    private final List<Integer> pauses = new ArrayList<>();

    @Test
    void pausesOnceThresholdIsReachedAndResetsCount() {
        PacingController pacing = controller(3, 30, 60);

        pacing.noteAction();
        pacing.noteAction();
        assertFalse(pacing.maybePause());
        pacing.noteAction();
        assertTrue(pacing.maybePause());

        assertEquals(0, pacing.actionsSincePause());
        assertEquals(1, pacing.pausesTaken());
        assertThat(pauses).singleElement().satisfies(seconds -> assertThat(seconds).isBetween(30, 60));
        assertThat(sleeps).singleElement().satisfies(d -> assertThat(d.toMillis()).isBetween(30_000L, 60_000L));
    }

    @Test
    void zeroThresholdDisablesPauses() {
        PacingController pacing = controller(0, 30, 60);
        for (int i = 0; i < 100; i++) {
            pacing.noteAction();
        }

        assertFalse(pacing.maybePause());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void holdDrawsWithinRange() {
        PacingController pacing = controller(0, 0, 0);

        double held = pacing.hold(2, 8);

        assertThat(held).isBetween(2.0, 8.0);
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void invertedPauseRangeCollapsesToMinimum() {
        PacingController pacing = controller(1, 40, 10);
        pacing.noteAction();

        pacing.maybePause();

        assertThat(pauses).containsExactly(40);
    }

    private PacingController controller(int after, double pauseMin, double pauseMax) {
        EventPublisher events = new EventPublisher(List.of(new WorkflowEventListener() {
            @Override
            public void onPause(int seconds) {
                pauses.add(seconds);
            }
        }));
        return new PacingController(after, pauseMin, pauseMax, 0, 0, new Random(11), duration -> sleeps.add(duration), events);
    }
}
