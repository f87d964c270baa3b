package com.reelpilot.session.service;

import com.reelpilot.session.model.CompletionReason;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JdbcSessionJournalTest {

    @Test
    void failureReasonsMapToFailedStatus() {
        assertEquals("FAILED", JdbcSessionJournal.statusFor(null));
        assertEquals("FAILED", JdbcSessionJournal.statusFor(CompletionReason.ERROR));
        assertEquals("FAILED", JdbcSessionJournal.statusFor(CompletionReason.RECOVERY_FAILED));
        assertEquals("FAILED", JdbcSessionJournal.statusFor(CompletionReason.NAVIGATION_FAILED));
    }

    @Test
    void userStopAndLimitsAreDistinguished() {
        assertEquals("STOPPED", JdbcSessionJournal.statusFor(CompletionReason.STOPPED_BY_USER));
        assertEquals("COMPLETED", JdbcSessionJournal.statusFor(CompletionReason.MAX_LIKES_REACHED));
        assertEquals("COMPLETED", JdbcSessionJournal.statusFor(CompletionReason.NO_MORE_TARGETS));
    }
}
