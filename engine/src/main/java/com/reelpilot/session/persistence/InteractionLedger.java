package com.reelpilot.session.persistence;

import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.util.Result;

import java.time.Duration;

/**
 * Durable at-most-once record of interactions per (account, target, kind). Implementations must
 * upsert on that key so concurrent sessions never duplicate a row.
 */
public interface InteractionLedger {

    /**
     * @param kind the kind to check, or null for any kind
     */
    Result<Boolean> hasRecentInteraction(String accountId, String targetIdentifier, InteractionKind kind, Duration window);

    Result<Void> recordInteraction(String accountId, String targetIdentifier, InteractionKind kind, boolean success, Long sessionId);

    /**
     * Distinct targets interacted with during sessions whose scope is {@code scope}.
     */
    Result<Integer> countInteractionsForScope(String accountId, String scope, Duration window);
}
