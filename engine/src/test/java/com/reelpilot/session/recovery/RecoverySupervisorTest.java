package com.reelpilot.session.recovery;

import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.ScreenSignature;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.screen.PopupDismisser;
import com.reelpilot.session.screen.ScreenActions;
import com.reelpilot.session.util.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecoverySupervisorTest {
    private static final ScreenSignature STUCK = new ScreenSignature(PageState.FEED, "alice_10");

    @Mock
    private ScreenActions screen;

    @Mock
    private PopupDismisser popups;

    private Stats stats;
    private RecoverySupervisor supervisor;

    @BeforeEach
    void setUp() {
        stats = new Stats();
        supervisor = new RecoverySupervisor(screen, popups, Sleeper.NONE, Duration.ZERO, stats);
    }

    @Test
    void softTierClearsWhenSignatureChanges() {
        RecoveryTier tier = supervisor.recover(STUCK, () -> new ScreenSignature(PageState.FEED, "bob_2"), checkpoint(() -> true));

        assertEquals(RecoveryTier.SOFT, tier);
        assertEquals(1, stats.get(StatsCounter.RECOVERIES));
        InOrder order = inOrder(popups, screen);
        order.verify(popups).dismissSystemDialog();
        order.verify(popups).dismissAll(stats);
        order.verify(screen).pressSystemBack();
        verify(screen, never()).restartApp();
    }

    @Test
    void hardTierRestartsAndReachesCheckpoint() {
        when(screen.restartApp()).thenReturn(true);

        RecoveryTier tier = supervisor.recover(STUCK, () -> STUCK, checkpoint(() -> true));

        assertEquals(RecoveryTier.HARD, tier);
        assertEquals(2, stats.get(StatsCounter.RECOVERIES));
    }

    @Test
    void hardTierFailsWhenRestartFails() {
        when(screen.restartApp()).thenReturn(false);

        assertEquals(RecoveryTier.FAILED, supervisor.hardRecover(checkpoint(() -> true)));
    }

    @Test
    void hardTierFailsWhenCheckpointIsUnreachableOrThrows() {
        when(screen.restartApp()).thenReturn(true);

        assertEquals(RecoveryTier.FAILED, supervisor.hardRecover(checkpoint(() -> false)));
        assertEquals(RecoveryTier.FAILED, supervisor.hardRecover(checkpoint(() -> {
            throw new IllegalStateException("navigation crashed");
        })));
    }

    private static Checkpoint checkpoint(BooleanSupplier reach) {
        return new Checkpoint(PageState.FEED, "feed", reach);
    }
}
