package com.reelpilot.session.navigation;

import com.reelpilot.session.detect.PageDetector;
import com.reelpilot.session.model.PageState;
import com.reelpilot.session.screen.LocatorSet;
import com.reelpilot.session.screen.PopupDismisser;
import com.reelpilot.session.screen.ScreenActions;
import com.reelpilot.session.screen.ScreenElement;
import com.reelpilot.session.screen.UiElement;
import com.reelpilot.session.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.function.BooleanSupplier;

public class StepNavigator implements Navigator {
    private static final Logger log = LoggerFactory.getLogger(StepNavigator.class);

    private final PageDetector detector;
    private final ScreenActions screen;
    private final PopupDismisser popups;
    private final Sleeper sleeper;
    private final Duration pollInterval;
    private final Duration stepTimeout;
    private final int stepRetries;

    public StepNavigator(
        PageDetector detector,
        ScreenActions screen,
        PopupDismisser popups,
        Sleeper sleeper,
        Duration pollInterval,
        Duration stepTimeout,
        int stepRetries
    ) {
        this.detector = detector;
        this.screen = screen;
        this.popups = popups;
        this.sleeper = sleeper;
        this.pollInterval = pollInterval.isZero() || pollInterval.isNegative() ? Duration.ofMillis(100) : pollInterval;
        this.stepTimeout = stepTimeout;
        this.stepRetries = Math.max(0, stepRetries);
    }

    @Override
    public boolean goTo(PageState target, List<NavigationStep> steps) {
        if (target != null && detector.classify() == target) {
            log.debug("Already on {}, skipping navigation", target);
            return true;
        }
        for (NavigationStep step : steps) {
            if (!runStep(step)) {
                log.warn("Navigation to {} failed at step '{}'", target, step.name());
                return false;
            }
        }
        if (target == null) {
            return true;
        }
        return awaitState(target, stepTimeout);
    }

    @Override
    public boolean ensureFeed() {
        return goTo(PageState.FEED, List.of(
            step("home tab", UiElement.HOME_TAB).expect(PageState.FEED)
        ));
    }

    @Override
    public boolean openProfileOf(String username) {
        String query = username == null ? "" : username.trim().replaceFirst("^@", "");
        if (query.isEmpty()) {
            return false;
        }
        if (isProfileOf(query)) {
            return true;
        }
        ensureFeed();
        return goTo(PageState.PROFILE, List.of(
            step("open search", UiElement.SEARCH_BUTTON).until(() -> screen.isPresent(UiElement.SEARCH_INPUT)),
            NavigationStep.of("submit query", () -> submitQuery(query))
                .until(() -> screen.isPresent(UiElement.SEARCH_USERS_TAB)),
            step("users tab", UiElement.SEARCH_USERS_TAB).until(() -> screen.isPresent(UiElement.FIRST_USER_RESULT)),
            step("first result", UiElement.FIRST_USER_RESULT).expect(PageState.PROFILE)
        ));
    }

    @Override
    public boolean openSearchVideos(String query) {
        String term = query == null ? "" : query.trim();
        if (term.isEmpty()) {
            return false;
        }
        ensureFeed();
        return goTo(PageState.VIDEO_PLAYER, List.of(
            step("open search", UiElement.SEARCH_BUTTON).until(() -> screen.isPresent(UiElement.SEARCH_INPUT)),
            NavigationStep.of("submit query", () -> submitQuery(term))
                .until(() -> screen.isPresent(UiElement.SEARCH_VIDEOS_TAB)),
            step("videos tab", UiElement.SEARCH_VIDEOS_TAB).until(() -> screen.isPresent(UiElement.FIRST_VIDEO_RESULT)),
            step("first video", UiElement.FIRST_VIDEO_RESULT).expect(PageState.VIDEO_PLAYER)
        ));
    }

    @Override
    public boolean openInbox() {
        return goTo(PageState.INBOX, List.of(
            step("inbox tab", UiElement.INBOX_TAB).expect(PageState.INBOX)
        ));
    }

    @Override
    public boolean openList(ListKind kind) {
        UiElement counter = kind == ListKind.FOLLOWING ? UiElement.FOLLOWING_COUNTER : UiElement.FOLLOWERS_COUNTER;
        return goTo(PageState.FOLLOWERS_LIST, List.of(
            step(kind.name().toLowerCase(Locale.ROOT) + " counter", counter).expect(PageState.FOLLOWERS_LIST)
        ));
    }

    @Override
    public boolean openOwnList(ListKind kind) {
        if (!goTo(PageState.PROFILE, List.of(step("profile tab", UiElement.PROFILE_TAB).expect(PageState.PROFILE)))) {
            return false;
        }
        return openList(kind);
    }

    @Override
    public boolean openProfileGridItem(int index) {
        return goTo(PageState.VIDEO_PLAYER, List.of(
            NavigationStep.of("grid item " + index, () -> tapGridItem(index)).expect(PageState.VIDEO_PLAYER)
        ));
    }

    @Override
    public boolean openHashtag(String tag) {
        String query = tag == null ? "" : tag.trim().replaceFirst("^#", "");
        if (query.isEmpty()) {
            return false;
        }
        ensureFeed();
        boolean onTagPage = goTo(null, List.of(
            step("open search", UiElement.SEARCH_BUTTON).until(() -> screen.isPresent(UiElement.SEARCH_INPUT)),
            NavigationStep.of("submit tag", () -> submitQuery("#" + query))
                .until(() -> screen.isPresent(UiElement.SEARCH_HASHTAGS_TAB)),
            step("hashtags tab", UiElement.SEARCH_HASHTAGS_TAB)
                .until(() -> screen.isPresent(UiElement.FIRST_HASHTAG_RESULT)),
            step("first hashtag", UiElement.FIRST_HASHTAG_RESULT)
                .until(() -> screen.isPresent(UiElement.PROFILE_POST_ITEM))
        ));
        return onTagPage && openProfileGridItem(0);
    }

    @Override
    public boolean returnTo(PageState target, int maxAttempts) {
        for (int attempt = 1; attempt <= Math.max(1, maxAttempts); attempt++) {
            PageState current = detector.classify();
            if (current == target) {
                return true;
            }
            log.debug("Return to {} attempt {}: currently on {}", target, attempt, current);
            if (current == PageState.STORY) {
                if (!screen.click(UiElement.STORY_CLOSE)) {
                    screen.pressSystemBack();
                }
            } else if (current == PageState.INBOX || current == PageState.UNKNOWN) {
                popups.dismissSystemDialog();
                screen.pressSystemBack();
            } else {
                screen.back();
            }
            sleeper.sleep(pollInterval);
        }
        return detector.classify() == target;
    }

    boolean runStep(NavigationStep step) {
        for (int attempt = 0; attempt <= step.maxRetries(); attempt++) {
            BooleanSupplier action = attempt > 0 && step.alternate() != null ? step.alternate() : step.action();
            boolean performed = safePerform(action, step.name());
            if (performed && confirm(step)) {
                return true;
            }
            log.debug("Step '{}' attempt {} not confirmed (performed={})", step.name(), attempt + 1, performed);
        }
        log.info("Step '{}' exhausted {} retries, dismissing popups and going back", step.name(), step.maxRetries());
        if (popups.dismissAll(null) > 0 && step.hasConfirmation() && confirm(step)) {
            return true;
        }
        screen.back();
        return false;
    }

    private boolean confirm(NavigationStep step) {
        if (!step.hasConfirmation()) {
            return true;
        }
        long polls = Math.max(1, step.timeout().toMillis() / pollInterval.toMillis());
        for (long i = 0; i < polls; i++) {
            boolean stateOk = step.expected() == null || detector.classify() == step.expected();
            boolean arrivedOk = step.arrived() == null || step.arrived().getAsBoolean();
            if (stateOk && arrivedOk) {
                return true;
            }
            if (!sleeper.sleep(pollInterval)) {
                return false;
            }
        }
        return false;
    }

    private boolean awaitState(PageState target, Duration timeout) {
        long polls = Math.max(1, timeout.toMillis() / pollInterval.toMillis());
        for (long i = 0; i < polls; i++) {
            if (detector.classify() == target) {
                return true;
            }
            if (!sleeper.sleep(pollInterval)) {
                return false;
            }
        }
        return false;
    }

    private boolean safePerform(BooleanSupplier action, String name) {
        try {
            return action.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Step '{}' action failed", name, e);
            return false;
        }
    }

    private NavigationStep step(String name, UiElement element) {
        LocatorSet alternate = screen.catalog().alternate(element);
        NavigationStep step = NavigationStep.of(name, () -> screen.click(element))
            .within(stepTimeout, stepRetries);
        if (alternate != null) {
            step = step.orElse(() -> screen.click(alternate, screen.actionTimeout()));
        }
        return step;
    }

    private boolean submitQuery(String query) {
        screen.click(UiElement.SEARCH_INPUT);
        return screen.typeAndSubmit(query);
    }

    private boolean tapGridItem(int index) {
        List<ScreenElement> items = screen.all(UiElement.PROFILE_POST_ITEM);
        if (index < 0 || index >= items.size() || items.get(index).bounds() == null) {
            return false;
        }
        ScreenElement item = items.get(index);
        return screen.tap(item.bounds().centerX(), item.bounds().centerY());
    }

    private boolean isProfileOf(String username) {
        if (detector.classify() != PageState.PROFILE) {
            return false;
        }
        return screen.text(UiElement.PROFILE_USERNAME)
            .map(value -> value.replaceFirst("^@", "").equalsIgnoreCase(username))
            .orElse(false);
    }
}
