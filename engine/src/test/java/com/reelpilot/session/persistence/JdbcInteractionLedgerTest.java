package com.reelpilot.session.persistence;

import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.InteractionRecord;
import com.reelpilot.session.util.ErrorKind;
import com.reelpilot.session.util.Result;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcInteractionLedgerTest {
    private static final Duration WEEK = Duration.ofDays(7);

    @Autowired
    private JdbcInteractionLedger ledger;

    @Autowired
    private SessionRunRepository sessions;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void repeatedRecordKeepsOneRowPerKey() {
        String account = account();

        ledger.recordInteraction(account, "@Alice", InteractionKind.LIKE, false, null);
        ledger.recordInteraction(account, "alice", InteractionKind.LIKE, true, null);

        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM interaction_history WHERE account_id = :accountId",
            new MapSqlParameterSource("accountId", account),
            Integer.class
        );
        assertEquals(1, rows);
        assertTrue(ledger.hasRecentInteraction(account, "alice", InteractionKind.LIKE, WEEK).value());
    }

    @Test
    void kindFilterIsOptional() {
        String account = account();
        ledger.recordInteraction(account, "bob", InteractionKind.FOLLOW, true, null);

        assertTrue(ledger.hasRecentInteraction(account, "bob", null, WEEK).value());
        assertTrue(ledger.hasRecentInteraction(account, "bob", InteractionKind.FOLLOW, WEEK).value());
        assertFalse(ledger.hasRecentInteraction(account, "bob", InteractionKind.LIKE, WEEK).value());
        assertFalse(ledger.hasRecentInteraction(account, "carol", null, WEEK).value());
    }

    @Test
    void failedAttemptsDoNotCountAsRecent() {
        String account = account();
        ledger.recordInteraction(account, "dave", InteractionKind.FOLLOW, false, null);

        assertFalse(ledger.hasRecentInteraction(account, "dave", null, WEEK).value());
    }

    @Test
    void recordsOutsideTheWindowAreIgnored() {
        String account = account();
        ledger.recordInteraction(account, "erin", InteractionKind.LIKE, true, null);
        jdbc.update(
            "UPDATE interaction_history SET created_at = :old WHERE account_id = :accountId",
            new MapSqlParameterSource()
                .addValue("old", Timestamp.from(Instant.now().minus(Duration.ofDays(30))))
                .addValue("accountId", account)
        );

        assertFalse(ledger.hasRecentInteraction(account, "erin", InteractionKind.LIKE, WEEK).value());
    }

    @Test
    void missingTargetIsRejected() {
        Result<Void> result = ledger.recordInteraction(account(), " ", InteractionKind.LIKE, true, null);

        assertTrue(result.isKind(ErrorKind.FATAL));
    }

    @Test
    void scopeCountUsesSessionScope() {
        String account = account();
        long sessionId = sessions.insertSession(account, "FOLLOWERS", "followers:@cats", "{}", Instant.now());
        ledger.recordInteraction(account, "frank", InteractionKind.FOLLOW, true, sessionId);
        ledger.recordInteraction(account, "frank", InteractionKind.LIKE, true, sessionId);
        ledger.recordInteraction(account, "gina", InteractionKind.LIKE, true, sessionId);
        ledger.recordInteraction(account, "hank", InteractionKind.LIKE, true, null);

        assertEquals(2, ledger.countInteractionsForScope(account, "Followers:@cats", WEEK).value());
        assertEquals(0, ledger.countInteractionsForScope(account, "followers:@dogs", WEEK).value());
    }

    @Test
    void recentInteractionsAreNewestFirst() {
        String account = account();
        ledger.recordInteraction(account, "ivy", InteractionKind.LIKE, true, null);
        ledger.recordInteraction(account, "jack", InteractionKind.FOLLOW, true, null);

        List<InteractionRecord> recent = ledger.findRecentInteractions(account, 10);

        assertEquals(2, recent.size());
        assertEquals("jack", recent.get(0).targetIdentifier());
        assertEquals(InteractionKind.FOLLOW, recent.get(0).kind());
    }

    private static String account() {
        return "acct-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
