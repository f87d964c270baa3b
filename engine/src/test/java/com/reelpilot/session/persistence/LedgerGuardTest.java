package com.reelpilot.session.persistence;

import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.util.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerGuardTest {
    private static final Duration WINDOW = Duration.ofHours(168);

    @Mock
    private InteractionLedger ledger;

    private Stats stats;
    private LedgerGuard guard;

    @BeforeEach
    void setUp() {
        stats = new Stats();
        guard = new LedgerGuard(ledger, "default", WINDOW, stats);
    }

    @Test
    void lookupNormalizesTheTarget() {
        when(ledger.hasRecentInteraction("default", "alice", InteractionKind.LIKE, WINDOW)).thenReturn(Result.ok(true));

        assertTrue(guard.hasRecent(" @Alice ", InteractionKind.LIKE));
        assertEquals(0, stats.get(StatsCounter.ERRORS));
    }

    @Test
    void failedLookupMeansNotInteracted() {
        when(ledger.hasRecentInteraction(any(), any(), any(), any())).thenReturn(Result.transientFailure("db down"));

        assertFalse(guard.hasRecent("alice", null));
        assertEquals(1, stats.get(StatsCounter.ERRORS));
    }

    @Test
    void throwingLedgerNeverEscapes() {
        when(ledger.hasRecentInteraction(any(), any(), any(), any())).thenThrow(new IllegalStateException("pool closed"));
        when(ledger.recordInteraction(any(), any(), any(), anyBoolean(), any())).thenThrow(new IllegalStateException("pool closed"));

        assertFalse(guard.hasRecent("alice", InteractionKind.FOLLOW));
        assertDoesNotThrow(() -> guard.record("alice", InteractionKind.FOLLOW, true, 3L));
        assertEquals(2, stats.get(StatsCounter.ERRORS));
    }

    @Test
    void invalidTargetsNeverReachTheLedger() {
        assertFalse(guard.hasRecent("a", InteractionKind.LIKE));
        guard.record("bad name!", InteractionKind.LIKE, true, null);

        verify(ledger, never()).hasRecentInteraction(any(), any(), any(), any());
        verify(ledger, never()).recordInteraction(any(), any(), any(), anyBoolean(), any());
        assertEquals(0, stats.get(StatsCounter.ERRORS));
    }

    @Test
    void scopeCountFallsBackToZero() {
        when(ledger.countInteractionsForScope("default", "followers:@cats", WINDOW)).thenReturn(Result.transientFailure("timeout"));

        assertEquals(0, guard.countForScope("followers:@cats"));
        assertEquals(1, stats.get(StatsCounter.ERRORS));
    }
}
