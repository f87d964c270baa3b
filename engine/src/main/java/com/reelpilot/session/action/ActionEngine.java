package com.reelpilot.session.action;

import com.reelpilot.session.model.ActionOutcome;
import com.reelpilot.session.model.Target;

import java.util.Optional;

public interface ActionEngine {

    /**
     * Applies the target filters; empty when the target may be acted on.
     */
    Optional<SkipReason> screen(Target target, ActionContext context);

    ActionOutcome decideAndExecute(Target target, ActionContext context);
}
