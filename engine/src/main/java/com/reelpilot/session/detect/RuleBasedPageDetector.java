package com.reelpilot.session.detect;

import com.reelpilot.session.model.PageState;
import com.reelpilot.session.screen.ScreenActions;
import com.reelpilot.session.screen.UiElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Evaluates detection rules top-down and returns the state of the first rule that is satisfied.
 */
public class RuleBasedPageDetector implements PageDetector {
    private static final Logger log = LoggerFactory.getLogger(RuleBasedPageDetector.class);

    public static final List<DetectionRule> DEFAULT_RULES = List.of(
        DetectionRule.any(PageState.INBOX, UiElement.INBOX_MARKER),
        new DetectionRule(
            PageState.STORY,
            List.of(UiElement.STORY_MARKER, UiElement.STORY_MESSAGE_INPUT, UiElement.STORY_CLOSE),
            2,
            List.of()
        ),
        new DetectionRule(
            PageState.FOLLOWERS_LIST,
            List.of(UiElement.FOLLOWERS_LIST, UiElement.FOLLOWERS_TAB_SELECTED),
            1,
            List.of()
        ),
        new DetectionRule(
            PageState.FEED,
            List.of(UiElement.HOME_TAB_SELECTED, UiElement.VIDEO_CONTAINER, UiElement.LIKE_BUTTON),
            2,
            List.of()
        ),
        new DetectionRule(
            PageState.VIDEO_PLAYER,
            List.of(UiElement.VIDEO_CONTAINER, UiElement.LIKE_BUTTON, UiElement.LIKED_INDICATOR),
            1,
            List.of(UiElement.HOME_TAB_SELECTED)
        ),
        new DetectionRule(
            PageState.PROFILE,
            List.of(UiElement.PROFILE_USERNAME, UiElement.PROFILE_STATS_LABEL, UiElement.PROFILE_GRID),
            2,
            List.of(UiElement.FOLLOWERS_LIST, UiElement.FOLLOWERS_TAB_SELECTED)
        ),
        DetectionRule.any(PageState.SEARCH_RESULTS, UiElement.SEARCH_USERS_TAB, UiElement.SEARCH_INPUT)
    );

    private final ScreenActions screen;
    private final List<DetectionRule> rules;

    public RuleBasedPageDetector(ScreenActions screen) {
        this(screen, DEFAULT_RULES);
    }

    public RuleBasedPageDetector(ScreenActions screen, List<DetectionRule> rules) {
        this.screen = screen;
        this.rules = List.copyOf(rules);
    }

    @Override
    public PageState classify() {
        for (DetectionRule rule : rules) {
            if (matches(rule)) {
                log.debug("Detected page {}", rule.state());
                return rule.state();
            }
        }
        return PageState.UNKNOWN;
    }

    private boolean matches(DetectionRule rule) {
        int matched = 0;
        int remaining = rule.markers().size();
        for (UiElement marker : rule.markers()) {
            if (screen.isPresent(marker)) {
                matched++;
            }
            remaining--;
            if (matched >= rule.requiredMatches()) {
                break;
            }
            if (matched + remaining < rule.requiredMatches()) {
                return false;
            }
        }
        if (matched < rule.requiredMatches()) {
            return false;
        }
        for (UiElement exclusion : rule.exclusions()) {
            if (screen.isPresent(exclusion)) {
                return false;
            }
        }
        return true;
    }
}
