package com.reelpilot.session.screen;

import com.reelpilot.session.model.Stats;
import com.reelpilot.session.model.StatsCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Closes interruptions in a fixed order: system dialog, notification banner, inbox, link email,
 * follow your friends, shared collections, then any generic popup.
 */
public class PopupDismisser {
    private static final Logger log = LoggerFactory.getLogger(PopupDismisser.class);

    private static final Duration SYSTEM_DIALOG_WAIT = Duration.ofMillis(500);

    private final ScreenActions screen;

    public PopupDismisser(ScreenActions screen) {
        this.screen = screen;
    }

    public boolean dismissSystemDialog() {
        if (screen.click(screen.catalog().get(UiElement.SYSTEM_DENY_BUTTON), SYSTEM_DIALOG_WAIT)) {
            log.warn("Permission dialog denied");
            return true;
        }
        if (screen.isPresent(UiElement.SYSTEM_DIALOG)) {
            log.warn("System dialog detected, pressing back");
            return screen.pressSystemBack();
        }
        return false;
    }

    /**
     * Runs the whole chain once.
     *
     * @return number of interruptions closed
     */
    public int dismissAll(Stats stats) {
        int closed = 0;
        if (dismissSystemDialog()) {
            closed++;
        }
        if (screen.isPresent(UiElement.NOTIFICATION_BANNER)) {
            log.debug("Notification banner detected, swiping it away");
            if (screen.swipeAwayBanner()) {
                closed++;
            }
        }
        if (screen.isPresent(UiElement.INBOX_MARKER)) {
            log.info("Inbox opened by accident, going back");
            if (screen.pressSystemBack()) {
                closed++;
            }
        }
        if (screen.isPresent(UiElement.LINK_EMAIL_POPUP)) {
            if (screen.click(UiElement.LINK_EMAIL_NOT_NOW) || screen.pressSystemBack()) {
                closed++;
            }
        }
        if (screen.isPresent(UiElement.FOLLOW_FRIENDS_POPUP)) {
            if (screen.clickFirst(UiElement.FOLLOW_FRIENDS_CLOSE, UiElement.POPUP_DISMISS, UiElement.POPUP_CLOSE)) {
                closed++;
            }
        }
        if (screen.isPresent(UiElement.COLLECTIONS_POPUP)) {
            if (screen.clickFirst(UiElement.COLLECTIONS_NOT_NOW, UiElement.POPUP_DISMISS, UiElement.POPUP_CLOSE)) {
                closed++;
            }
        }
        if (closed == 0 && screen.clickFirst(UiElement.POPUP_DISMISS)) {
            closed++;
        }
        if (closed > 0 && stats != null) {
            for (int i = 0; i < closed; i++) {
                stats.increment(StatsCounter.POPUPS_CLOSED);
            }
        }
        return closed;
    }
}
