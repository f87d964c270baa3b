package com.reelpilot.session.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Which action kinds were attempted on a target and whether each succeeded. A skipped target has
 * a skip reason and no attempts.
 */
public record ActionOutcome(
    Map<InteractionKind, Boolean> attempts,
    String skipReason
) {
    public static ActionOutcome skipped(String reason) {
        return new ActionOutcome(Map.of(), reason);
    }

    public static ActionOutcome of(EnumMap<InteractionKind, Boolean> attempts) {
        return new ActionOutcome(Collections.unmodifiableMap(new EnumMap<>(attempts)), null);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public boolean attempted(InteractionKind kind) {
        return attempts.containsKey(kind);
    }

    public boolean succeeded(InteractionKind kind) {
        return Boolean.TRUE.equals(attempts.get(kind));
    }

    public int successCount() {
        int count = 0;
        for (Boolean value : attempts.values()) {
            if (Boolean.TRUE.equals(value)) {
                count++;
            }
        }
        return count;
    }
}
