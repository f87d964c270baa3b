package com.reelpilot.session.model;

import java.time.Instant;
import java.util.Map;

public record WorkflowSessionView(
    long id,
    String accountId,
    String workflowType,
    String scope,
    String status,
    String completionReason,
    Instant startedAt,
    Instant finishedAt,
    Map<String, Object> stats
) {
}
