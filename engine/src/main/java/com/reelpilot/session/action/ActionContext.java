package com.reelpilot.session.action;

import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.Stats;

import java.util.EnumSet;
import java.util.Set;

/**
 * @param consultLedger false when the caller already screened the target against the ledger
 *                      (posts of a profile opened from a list)
 */
public record ActionContext(
    Stats stats,
    Surface surface,
    Set<InteractionKind> kinds,
    boolean consultLedger,
    Long sessionId
) {
    public ActionContext {
        kinds = kinds == null || kinds.isEmpty() ? EnumSet.noneOf(InteractionKind.class) : EnumSet.copyOf(kinds);
    }

    public static ActionContext video(Stats stats, Long sessionId) {
        return new ActionContext(
            stats,
            Surface.VIDEO,
            EnumSet.of(InteractionKind.LIKE, InteractionKind.FOLLOW, InteractionKind.FAVORITE, InteractionKind.COMMENT, InteractionKind.SHARE),
            true,
            sessionId
        );
    }

    public ActionContext withSurface(Surface newSurface, Set<InteractionKind> newKinds) {
        return new ActionContext(stats, newSurface, newKinds, consultLedger, sessionId);
    }

    public ActionContext withoutLedger() {
        return new ActionContext(stats, surface, kinds, false, sessionId);
    }
}
