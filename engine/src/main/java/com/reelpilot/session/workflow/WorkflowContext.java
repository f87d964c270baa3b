package com.reelpilot.session.workflow;

import com.reelpilot.session.action.ActionEngine;
import com.reelpilot.session.detect.PageDetector;
import com.reelpilot.session.event.EventPublisher;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.navigation.Navigator;
import com.reelpilot.session.pacing.PacingController;
import com.reelpilot.session.persistence.LedgerGuard;
import com.reelpilot.session.recovery.RecoverySupervisor;
import com.reelpilot.session.recovery.StuckDetector;
import com.reelpilot.session.screen.PopupDismisser;
import com.reelpilot.session.screen.ScreenActions;
import com.reelpilot.session.screen.ScreenReader;
import com.reelpilot.session.util.Sleeper;

/**
 * Capabilities one workflow run is composed of. Everything here belongs to a single device session.
 */
public record WorkflowContext(
    RunConfig config,
    Stats stats,
    ScreenActions screen,
    ScreenReader reader,
    PageDetector detector,
    Navigator navigator,
    PopupDismisser popups,
    ActionEngine engine,
    PacingController pacing,
    StuckDetector stuckDetector,
    RecoverySupervisor recovery,
    LedgerGuard ledger,
    EventPublisher events,
    SessionJournal journal,
    Sleeper sleeper
) {
}
