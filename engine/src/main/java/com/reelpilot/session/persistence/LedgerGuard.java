package com.reelpilot.session.persistence;

import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.util.Result;
import com.reelpilot.session.util.UsernameRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Session-side view of the ledger. Any failure, returned or thrown, degrades to "not previously
 * interacted" and bumps {@code errors}; the session never aborts because of the ledger.
 */
public class LedgerGuard {
    private static final Logger log = LoggerFactory.getLogger(LedgerGuard.class);

    private final InteractionLedger ledger;
    private final String accountId;
    private final Duration window;
    private final Stats stats;

    public LedgerGuard(InteractionLedger ledger, String accountId, Duration window, Stats stats) {
        this.ledger = ledger;
        this.accountId = accountId;
        this.window = window;
        this.stats = stats;
    }

    public boolean hasRecent(String targetIdentifier, InteractionKind kind) {
        String target = UsernameRules.normalize(targetIdentifier);
        if (!UsernameRules.isValid(target)) {
            return false;
        }
        try {
            Result<Boolean> result = ledger.hasRecentInteraction(accountId, target, kind, window);
            if (result.isErr()) {
                degraded("lookup", target, result);
                return false;
            }
            return Boolean.TRUE.equals(result.value());
        } catch (RuntimeException e) {
            log.warn("Ledger lookup for {} threw; treating as not interacted", target, e);
            stats.increment(StatsCounter.ERRORS);
            return false;
        }
    }

    public void record(String targetIdentifier, InteractionKind kind, boolean success, Long sessionId) {
        String target = UsernameRules.normalize(targetIdentifier);
        if (!UsernameRules.isValid(target)) {
            return;
        }
        try {
            Result<Void> result = ledger.recordInteraction(accountId, target, kind, success, sessionId);
            if (result.isErr()) {
                degraded("record", target, result);
            }
        } catch (RuntimeException e) {
            log.warn("Ledger record of {} for {} threw", kind, target, e);
            stats.increment(StatsCounter.ERRORS);
        }
    }

    public int countForScope(String scope) {
        try {
            Result<Integer> result = ledger.countInteractionsForScope(accountId, scope, window);
            if (result.isErr()) {
                degraded("scope count", scope, result);
                return 0;
            }
            return result.orElse(0);
        } catch (RuntimeException e) {
            log.warn("Ledger scope count for {} threw", scope, e);
            stats.increment(StatsCounter.ERRORS);
            return 0;
        }
    }

    private void degraded(String operation, String subject, Result<?> result) {
        log.warn("Ledger {} for {} unavailable ({}: {})", operation, subject, result.errorKind(), result.errorMessage());
        stats.increment(StatsCounter.ERRORS);
    }
}
