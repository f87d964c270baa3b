package com.reelpilot.session.model;

import java.util.Map;

public record SessionRunStatus(
    boolean running,
    boolean paused,
    String workflowType,
    Long sessionId,
    String completionReason,
    Map<String, Object> stats
) {
    public static SessionRunStatus idle() {
        return new SessionRunStatus(false, false, null, null, null, Map.of());
    }
}
