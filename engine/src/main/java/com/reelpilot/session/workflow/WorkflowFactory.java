package com.reelpilot.session.workflow;

import com.reelpilot.config.SessionProperties;
import com.reelpilot.session.action.ProbabilisticActionEngine;
import com.reelpilot.session.detect.RuleBasedPageDetector;
import com.reelpilot.session.event.EventPublisher;
import com.reelpilot.session.event.WorkflowEventListener;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.navigation.StepNavigator;
import com.reelpilot.session.pacing.PacingController;
import com.reelpilot.session.persistence.InteractionLedger;
import com.reelpilot.session.persistence.LedgerGuard;
import com.reelpilot.session.recovery.RecoverySupervisor;
import com.reelpilot.session.recovery.StuckDetector;
import com.reelpilot.session.screen.LocatorCatalog;
import com.reelpilot.session.screen.LocatorScreenReader;
import com.reelpilot.session.screen.PopupDismisser;
import com.reelpilot.session.screen.ScreenActions;
import com.reelpilot.session.screen.ScreenStateProvider;
import com.reelpilot.session.util.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Wires a fresh set of per-run components for one {@link RunConfig}.
 */
@Component
public class WorkflowFactory {
    private final SessionProperties properties;
    private final ScreenStateProvider provider;
    private final LocatorCatalog catalog;
    private final InteractionLedger ledger;
    private final List<WorkflowEventListener> listeners;
    private final SessionJournal journal;

    public WorkflowFactory(
        SessionProperties properties,
        ScreenStateProvider provider,
        LocatorCatalog catalog,
        InteractionLedger ledger,
        List<WorkflowEventListener> listeners,
        SessionJournal journal
    ) {
        this.properties = properties;
        this.provider = provider;
        this.catalog = catalog;
        this.ledger = ledger;
        this.listeners = listeners;
        this.journal = journal;
    }

    public Workflow create(RunConfig config) {
        return create(config, Sleeper.threadSleeper());
    }

    Workflow create(RunConfig config, Sleeper sleeper) {
        WorkflowContext ctx = context(config, sleeper);
        return switch (config.workflowType()) {
            case FEED -> new FeedWorkflow(ctx);
            case FOLLOWERS -> new FollowersWorkflow(ctx);
            case SEARCH -> new SearchWorkflow(ctx);
            case SCRAPER -> new ScraperWorkflow(ctx);
            case UNFOLLOW -> new UnfollowWorkflow(ctx);
            case DM -> new DmWorkflow(ctx);
        };
    }

    WorkflowContext context(RunConfig config, Sleeper sleeper) {
        Random random = config.seed() == null ? new Random() : new Random(config.seed());
        Stats stats = new Stats();
        EventPublisher events = new EventPublisher(listeners);

        SessionProperties.Device device = properties.getDevice();
        SessionProperties.Navigation navigation = properties.getNavigation();
        ScreenActions screen = new ScreenActions(
            provider,
            catalog,
            Duration.ofMillis(device.getLookupTimeoutMs()),
            Duration.ofMillis(device.getActionTimeoutMs())
        );
        PopupDismisser popups = new PopupDismisser(screen);
        RuleBasedPageDetector detector = new RuleBasedPageDetector(screen);
        StepNavigator navigator = new StepNavigator(
            detector,
            screen,
            popups,
            sleeper,
            Duration.ofMillis(navigation.getPollIntervalMs()),
            Duration.ofMillis(navigation.getStepTimeoutMs()),
            navigation.getStepRetries()
        );
        PacingController pacing = new PacingController(
            config.pauseAfterActions(),
            config.pauseDurationMin(),
            config.pauseDurationMax(),
            config.minDelay(),
            config.maxDelay(),
            random,
            sleeper,
            events
        );
        LedgerGuard ledgerGuard = new LedgerGuard(ledger, config.accountId(), Duration.ofHours(config.cooldownHours()), stats);
        ProbabilisticActionEngine engine = new ProbabilisticActionEngine(config, screen, ledgerGuard, pacing, events, random);
        RecoverySupervisor recovery = new RecoverySupervisor(
            screen,
            popups,
            sleeper,
            Duration.ofSeconds(properties.getRecovery().getRestartSettleSeconds()),
            stats
        );
        return new WorkflowContext(
            config,
            stats,
            screen,
            new LocatorScreenReader(screen),
            detector,
            navigator,
            popups,
            engine,
            pacing,
            new StuckDetector(config.stuckThreshold()),
            recovery,
            ledgerGuard,
            events,
            journal,
            sleeper
        );
    }
}
