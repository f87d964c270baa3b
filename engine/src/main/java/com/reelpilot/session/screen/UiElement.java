package com.reelpilot.session.screen;

import java.util.Locale;

/**
 * Every UI element the engine addresses. The XPath alternatives live in configuration under
 * {@code session.locators.<key>}.
 */
public enum UiElement {
    HOME_TAB,
    HOME_TAB_SELECTED,
    PROFILE_TAB,
    INBOX_TAB,
    INBOX_MARKER,
    SEARCH_BUTTON,
    SEARCH_INPUT,
    SEARCH_SUBMIT,
    SEARCH_USERS_TAB,
    SEARCH_HASHTAGS_TAB,
    SEARCH_VIDEOS_TAB,
    FIRST_USER_RESULT,
    FIRST_HASHTAG_RESULT,
    FIRST_VIDEO_RESULT,
    BACK_BUTTON,

    VIDEO_CONTAINER,
    AUTHOR_USERNAME,
    VIDEO_DESCRIPTION,
    LIKE_COUNT,
    LIKE_BUTTON,
    LIKED_INDICATOR,
    VIDEO_FOLLOW_BUTTON,
    FAVORITE_BUTTON,
    FAVORITED_INDICATOR,
    COMMENT_BUTTON,
    COMMENT_INPUT,
    COMMENT_SEND,
    SHARE_BUTTON,
    SHARE_COPY_LINK,
    AD_LABEL,

    STORY_MARKER,
    STORY_MESSAGE_INPUT,
    STORY_CLOSE,
    STORY_LIKE_BUTTON,

    PROFILE_USERNAME,
    PROFILE_DISPLAY_NAME,
    PROFILE_STATS_LABEL,
    PROFILE_GRID,
    PROFILE_POST_ITEM,
    PROFILE_FOLLOW_BUTTON,
    PROFILE_FOLLOWING_BUTTON,
    PROFILE_MESSAGE_BUTTON,
    PROFILE_BIO,
    PROFILE_PRIVATE_NOTICE,
    PROFILE_VERIFIED_BADGE,
    FOLLOWERS_COUNT,
    FOLLOWING_COUNT,
    LIKES_COUNT,
    FOLLOWERS_COUNTER,
    FOLLOWING_COUNTER,

    FOLLOWERS_LIST,
    FOLLOWERS_TAB_SELECTED,
    ROW_USERNAME,
    ROW_DISPLAY_NAME,
    ROW_BUTTON,
    UNFOLLOW_CONFIRM,

    INBOX_CONVERSATION_NAME,
    CONVERSATION_GROUP_MEMBERS,
    MESSAGE_INPUT,
    MESSAGE_SEND,
    MESSAGE_BLOCKED,

    SYSTEM_DENY_BUTTON,
    SYSTEM_DIALOG,
    NOTIFICATION_BANNER,
    LINK_EMAIL_POPUP,
    LINK_EMAIL_NOT_NOW,
    FOLLOW_FRIENDS_POPUP,
    FOLLOW_FRIENDS_CLOSE,
    COLLECTIONS_POPUP,
    COLLECTIONS_NOT_NOW,
    POPUP_DISMISS,
    POPUP_CLOSE,
    SUGGESTION_PAGE,
    SUGGESTION_FOLLOW_BACK,
    SUGGESTION_NOT_INTERESTED,
    SUGGESTION_CLOSE,
    COMMENTS_SECTION,
    COMMENTS_CLOSE;

    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static UiElement fromKey(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (UiElement element : values()) {
            if (element.name().equals(normalized)) {
                return element;
            }
        }
        return null;
    }
}
