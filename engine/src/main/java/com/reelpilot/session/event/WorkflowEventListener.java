package com.reelpilot.session.event;

import java.util.Map;

/**
 * Fire-and-forget callbacks for external consumers. Payloads are plain maps.
 */
public interface WorkflowEventListener {

    default void onStats(Map<String, Object> stats) {
    }

    default void onAction(Map<String, Object> action) {
    }

    default void onPause(int seconds) {
    }

    default void onVideo(Map<String, Object> video) {
    }
}
