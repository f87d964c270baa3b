package com.reelpilot.session.workflow;

import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.ListRow;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.ScreenSignature;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.navigation.ListKind;
import com.reelpilot.session.recovery.Checkpoint;
import com.reelpilot.session.recovery.RecoveryTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Run template shared by all workflows: session envelope, cooperative stop/pause, failure
 * threshold and stuck handling. Subclasses implement the loop in {@link #execute()}.
 */
public abstract class AbstractWorkflow implements Workflow {
    private static final Logger log = LoggerFactory.getLogger(AbstractWorkflow.class);

    protected final WorkflowContext ctx;
    protected final RunConfig config;
    protected final Stats stats;

    private final Object pauseLock = new Object();
    private volatile boolean running;
    private volatile boolean stopRequested;
    private volatile boolean paused;
    private volatile Long sessionId;
    private int loopFailures;

    protected AbstractWorkflow(WorkflowContext ctx) {
        this.ctx = ctx;
        this.config = ctx.config();
        this.stats = ctx.stats();
    }

    protected abstract void execute();

    @Override
    public final Stats run() {
        running = true;
        sessionId = openSession();
        log.info("Starting {} workflow for account {} (session {})", type(), config.accountId(), sessionId);
        try {
            execute();
        } catch (RuntimeException e) {
            log.error("{} workflow aborted by unexpected error", type(), e);
            stats.increment(StatsCounter.ERRORS);
            stats.setErrorSummary(e.getClass().getSimpleName() + ": " + e.getMessage());
            stats.complete(CompletionReason.ERROR);
        } finally {
            running = false;
            stats.complete(stopRequested ? CompletionReason.STOPPED_BY_USER : CompletionReason.COMPLETED);
            ctx.events().stats(stats.toMap());
            closeSession();
            log.info("{} workflow finished: {} {}", type(), stats.completionReason().code(), stats.toMap());
        }
        return stats;
    }

    @Override
    public void stop() {
        stopRequested = true;
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public void pause() {
        paused = true;
    }

    @Override
    public void resume() {
        synchronized (pauseLock) {
            paused = false;
            pauseLock.notifyAll();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    @Override
    public Stats stats() {
        return stats;
    }

    @Override
    public Long sessionId() {
        return sessionId;
    }

    /**
     * Iteration boundary: blocks while paused, then reports whether the loop may go on.
     */
    protected boolean shouldContinue() {
        waitWhilePaused();
        if (stopRequested) {
            stats.complete(CompletionReason.STOPPED_BY_USER);
            return false;
        }
        return !stats.isCompleted();
    }

    protected boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Counts a per-target failure.
     *
     * @return false when the failure threshold is exceeded and the run has been completed
     */
    protected boolean recordFailure(String where, Exception e) {
        loopFailures++;
        stats.increment(StatsCounter.ERRORS);
        log.warn("{} failed ({} of {} allowed)", where, loopFailures, config.maxErrors(), e);
        if (loopFailures > config.maxErrors()) {
            stats.setErrorSummary("Too many errors (" + loopFailures + "), last in " + where + ": " + e.getMessage());
            ctx.events().stats(stats.toMap());
            stats.complete(CompletionReason.ERROR);
            return false;
        }
        return true;
    }

    /**
     * Feeds the signature to the stuck detector and runs recovery when it fires.
     */
    protected StuckCheck checkStuck(ScreenSignature signature, Supplier<ScreenSignature> rescan, Checkpoint checkpoint) {
        if (!ctx.stuckDetector().observe(signature)) {
            return StuckCheck.PROGRESSING;
        }
        RecoveryTier tier = ctx.recovery().recover(signature, rescan, checkpoint);
        if (tier == RecoveryTier.FAILED) {
            stats.complete(CompletionReason.RECOVERY_FAILED);
            return StuckCheck.FAILED;
        }
        return StuckCheck.RECOVERED;
    }

    /**
     * Back from a list lands on the owning profile, so soft recovery is followed by reopening the list.
     */
    protected boolean reenterList(ListKind kind, Checkpoint checkpoint) {
        PageState state = ctx.detector().classify();
        if (state == PageState.FOLLOWERS_LIST) {
            return true;
        }
        if (state == PageState.PROFILE && ctx.navigator().openList(kind)) {
            log.info("Reopened the {} list after recovery", kind);
            return true;
        }
        return hardRecover(checkpoint);
    }

    /**
     * Signature of the list currently on screen, or null once the screen is no longer a list.
     */
    protected ScreenSignature rescanList(Function<List<ListRow>, ScreenSignature> signature) {
        if (ctx.detector().classify() != PageState.FOLLOWERS_LIST) {
            return null;
        }
        List<ListRow> rows = ctx.reader().visibleRows();
        return rows.isEmpty() ? null : signature.apply(rows);
    }

    /**
     * Restarts the app and navigates to {@code checkpoint}; completes the run when that fails.
     */
    protected boolean hardRecover(Checkpoint checkpoint) {
        if (ctx.recovery().hardRecover(checkpoint) == RecoveryTier.FAILED) {
            stats.complete(CompletionReason.RECOVERY_FAILED);
            return false;
        }
        return true;
    }

    /**
     * Stops the loop on the session caps of the action kinds that are enabled.
     */
    protected boolean sessionCapReached() {
        if (config.likeProbability() > 0 && stats.get(StatsCounter.LIKED) >= config.maxLikesPerSession()) {
            stats.complete(CompletionReason.MAX_LIKES_REACHED);
            return true;
        }
        if (config.followProbability() > 0 && stats.get(StatsCounter.FOLLOWED) >= config.maxFollowsPerSession()) {
            stats.complete(CompletionReason.MAX_FOLLOWS_REACHED);
            return true;
        }
        return false;
    }

    private void waitWhilePaused() {
        synchronized (pauseLock) {
            while (paused && !stopRequested) {
                try {
                    pauseLock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stopRequested = true;
                }
            }
        }
    }

    private Long openSession() {
        try {
            return ctx.journal().open(config);
        } catch (RuntimeException e) {
            log.warn("Unable to record session start; continuing without a session id", e);
            stats.increment(StatsCounter.ERRORS);
            return null;
        }
    }

    private void closeSession() {
        try {
            ctx.journal().close(sessionId, stats);
        } catch (RuntimeException e) {
            log.warn("Unable to record session {} completion", sessionId, e);
        }
    }

    protected enum StuckCheck {
        PROGRESSING,
        RECOVERED,
        FAILED
    }
}
