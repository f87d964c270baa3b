package com.reelpilot.session.navigation;

import com.reelpilot.session.model.PageState;

import java.util.List;

public interface Navigator {

    /**
     * Runs {@code steps} in order until {@code target} is reached. Returns true immediately when
     * the screen already is {@code target}.
     */
    boolean goTo(PageState target, List<NavigationStep> steps);

    boolean ensureFeed();

    /**
     * search, submit query, Users tab, first result.
     */
    boolean openProfileOf(String username);

    /**
     * search, submit query, Videos tab, first video.
     */
    boolean openSearchVideos(String query);

    boolean openInbox();

    boolean openList(ListKind kind);

    boolean openOwnList(ListKind kind);

    boolean openProfileGridItem(int index);

    /**
     * search, submit tag, Hashtags tab, first result, first video.
     */
    boolean openHashtag(String tag);

    boolean returnTo(PageState target, int maxAttempts);

    default boolean openListOf(String username, ListKind kind) {
        return openProfileOf(username) && openList(kind);
    }
}
