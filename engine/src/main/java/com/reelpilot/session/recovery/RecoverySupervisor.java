package com.reelpilot.session.recovery;

import com.reelpilot.session.model.ScreenSignature;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import com.reelpilot.session.screen.PopupDismisser;
import com.reelpilot.session.screen.ScreenActions;
import com.reelpilot.session.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Escalating recovery: soft (dialogs, popups, back) and, if the screen still has not moved, hard
 * (restart the app and navigate back to the checkpoint).
 */
public class RecoverySupervisor {
    private static final Logger log = LoggerFactory.getLogger(RecoverySupervisor.class);
    private static final Duration SOFT_SETTLE = Duration.ofMillis(500);

    private final ScreenActions screen;
    private final PopupDismisser popups;
    private final Sleeper sleeper;
    private final Duration restartSettle;
    private final Stats stats;

    public RecoverySupervisor(
        ScreenActions screen,
        PopupDismisser popups,
        Sleeper sleeper,
        Duration restartSettle,
        Stats stats
    ) {
        this.screen = screen;
        this.popups = popups;
        this.sleeper = sleeper;
        this.restartSettle = restartSettle;
        this.stats = stats;
    }

    /**
     * @param stuck      the signature that repeated
     * @param rescan     reads the current signature again after the soft tier
     * @param checkpoint where the hard tier navigates to
     */
    public RecoveryTier recover(ScreenSignature stuck, Supplier<ScreenSignature> rescan, Checkpoint checkpoint) {
        if (softRecover(stuck, rescan)) {
            return RecoveryTier.SOFT;
        }
        return hardRecover(checkpoint);
    }

    public boolean softRecover(ScreenSignature stuck, Supplier<ScreenSignature> rescan) {
        log.warn("No progress on {} ({}), trying soft recovery", stuck.state(), stuck.discriminator());
        stats.increment(StatsCounter.RECOVERIES);
        popups.dismissSystemDialog();
        popups.dismissAll(stats);
        screen.pressSystemBack();
        sleeper.sleep(SOFT_SETTLE);
        ScreenSignature after = rescan.get();
        boolean cleared = after == null || !after.equals(stuck);
        if (cleared) {
            log.info("Soft recovery moved the screen on");
        }
        return cleared;
    }

    public RecoveryTier hardRecover(Checkpoint checkpoint) {
        log.warn("Hard recovery: restarting app, checkpoint {}", checkpoint == null ? "none" : checkpoint.description());
        stats.increment(StatsCounter.RECOVERIES);
        if (!screen.restartApp()) {
            log.error("App restart failed; recovery aborted");
            return RecoveryTier.FAILED;
        }
        sleeper.sleep(restartSettle);
        if (checkpoint == null || checkpoint.reach() == null) {
            return RecoveryTier.HARD;
        }
        boolean reached;
        try {
            reached = checkpoint.reach().getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Navigation to checkpoint {} threw", checkpoint.description(), e);
            reached = false;
        }
        if (!reached) {
            log.error("Could not reach checkpoint {} after restart", checkpoint.description());
            return RecoveryTier.FAILED;
        }
        log.info("Back at checkpoint {}", checkpoint.description());
        return RecoveryTier.HARD;
    }
}
