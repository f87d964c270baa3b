package com.reelpilot.session.pacing;

import com.reelpilot.session.event.EventPublisher;
import com.reelpilot.session.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts actions and inserts a randomized rest once {@code pauseAfterActions} have been made.
 * The rest is a blocking sleep and is not interrupted by a stop request.
 */
public class PacingController {
    private static final Logger log = LoggerFactory.getLogger(PacingController.class);

    private final int pauseAfterActions;
    private final double pauseMinSeconds;
    private final double pauseMaxSeconds;
    private final double minDelaySeconds;
    private final double maxDelaySeconds;
    private final Random random;
    private final Sleeper sleeper;
    private final EventPublisher events;
    private final AtomicInteger actionsSincePause = new AtomicInteger();
    private final AtomicInteger pausesTaken = new AtomicInteger();

    public PacingController(
        int pauseAfterActions,
        double pauseMinSeconds,
        double pauseMaxSeconds,
        double minDelaySeconds,
        double maxDelaySeconds,
        Random random,
        Sleeper sleeper,
        EventPublisher events
    ) {
        this.pauseAfterActions = pauseAfterActions;
        this.pauseMinSeconds = Math.max(0, pauseMinSeconds);
        this.pauseMaxSeconds = Math.max(this.pauseMinSeconds, pauseMaxSeconds);
        this.minDelaySeconds = Math.max(0, minDelaySeconds);
        this.maxDelaySeconds = Math.max(this.minDelaySeconds, maxDelaySeconds);
        this.random = random;
        this.sleeper = sleeper;
        this.events = events;
    }

    public void noteAction() {
        actionsSincePause.incrementAndGet();
    }

    /**
     * @return true when a pause was taken
     */
    public boolean maybePause() {
        if (pauseAfterActions <= 0 || actionsSincePause.get() < pauseAfterActions) {
            return false;
        }
        double duration = uniform(pauseMinSeconds, pauseMaxSeconds);
        int seconds = (int) Math.round(duration);
        log.info("Pausing {}s after {} actions", seconds, actionsSincePause.get());
        events.pause(seconds);
        sleeper.sleepSeconds(duration);
        actionsSincePause.set(0);
        pausesTaken.incrementAndGet();
        return true;
    }

    public void delayBetweenActions() {
        sleeper.sleepSeconds(uniform(minDelaySeconds, maxDelaySeconds));
    }

    /**
     * Blocks for {@code uniform(min, max)} seconds and returns the drawn duration.
     */
    public double hold(double minSeconds, double maxSeconds) {
        double duration = uniform(Math.max(0, minSeconds), Math.max(minSeconds, maxSeconds));
        sleeper.sleepSeconds(duration);
        return duration;
    }

    public int actionsSincePause() {
        return actionsSincePause.get();
    }

    public int pausesTaken() {
        return pausesTaken.get();
    }

    private double uniform(double min, double max) {
        if (max <= min) {
            return min;
        }
        return min + (max - min) * random.nextDouble();
    }
}
