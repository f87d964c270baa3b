package com.reelpilot.session.model;

import java.time.Instant;

public record InteractionRecord(
    String accountId,
    String targetIdentifier,
    InteractionKind kind,
    boolean success,
    Instant timestamp,
    Long sessionId
) {
}
