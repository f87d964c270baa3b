package com.reelpilot.session.screen;

import com.reelpilot.session.model.InboxConversation;
import com.reelpilot.session.model.ListRow;
import com.reelpilot.session.model.ProfileSnapshot;
import com.reelpilot.session.model.VideoDetails;
import com.reelpilot.session.util.CountParser;
import com.reelpilot.session.util.UsernameRules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class LocatorScreenReader implements ScreenReader {
    private static final int ROW_MATCH_TOLERANCE_PX = 120;

    private final ScreenActions screen;

    public LocatorScreenReader(ScreenActions screen) {
        this.screen = screen;
    }

    @Override
    public Optional<VideoDetails> readCurrentVideo() {
        Optional<String> author = screen.text(UiElement.AUTHOR_USERNAME);
        boolean hasLikeButton = screen.isPresent(UiElement.LIKE_BUTTON) || screen.isPresent(UiElement.LIKED_INDICATOR);
        if (author.isEmpty() && !hasLikeButton) {
            return Optional.empty();
        }
        String likeCountText = screen.text(UiElement.LIKE_COUNT).orElse(null);
        return Optional.of(new VideoDetails(
            author.map(UsernameRules::normalize).orElse(null),
            screen.text(UiElement.VIDEO_DESCRIPTION).orElse(null),
            likeCountText,
            CountParser.parse(likeCountText),
            screen.isPresent(UiElement.LIKED_INDICATOR),
            screen.isPresent(UiElement.FAVORITED_INDICATOR),
            screen.isPresent(UiElement.AD_LABEL)
        ));
    }

    @Override
    public List<ListRow> visibleRows() {
        List<ScreenElement> usernames = screen.all(UiElement.ROW_USERNAME);
        if (usernames.isEmpty()) {
            return List.of();
        }
        List<ScreenElement> displayNames = screen.all(UiElement.ROW_DISPLAY_NAME);
        List<ScreenElement> buttons = screen.all(UiElement.ROW_BUTTON);
        List<ListRow> rows = new ArrayList<>();
        for (ScreenElement username : usernames) {
            String name = UsernameRules.normalize(username.textOrDescription());
            if (name == null || username.bounds() == null) {
                continue;
            }
            int centerY = username.bounds().centerY();
            ScreenElement displayName = nearest(displayNames, centerY);
            ScreenElement button = nearest(buttons, centerY);
            rows.add(new ListRow(
                name,
                displayName == null ? null : displayName.textOrDescription(),
                button == null ? null : button.textOrDescription(),
                username.bounds().centerX(),
                centerY,
                button == null || button.bounds() == null ? 0 : button.bounds().centerX(),
                button == null || button.bounds() == null ? 0 : button.bounds().centerY()
            ));
        }
        return rows;
    }

    @Override
    public ProfileSnapshot readProfile() {
        String username = screen.text(UiElement.PROFILE_USERNAME).map(UsernameRules::normalize).orElse(null);
        return new ProfileSnapshot(
            username,
            screen.text(UiElement.PROFILE_DISPLAY_NAME).orElse(null),
            screen.text(UiElement.FOLLOWERS_COUNT).map(CountParser::parse).orElse(null),
            screen.text(UiElement.FOLLOWING_COUNT).map(CountParser::parse).orElse(null),
            screen.text(UiElement.LIKES_COUNT).map(CountParser::parse).orElse(null),
            screen.text(UiElement.PROFILE_BIO).orElse(null),
            screen.isPresent(UiElement.PROFILE_PRIVATE_NOTICE),
            screen.isPresent(UiElement.PROFILE_VERIFIED_BADGE),
            screen.isPresent(UiElement.PROFILE_FOLLOWING_BUTTON)
        );
    }

    @Override
    public Long readFollowersCount() {
        return screen.text(UiElement.FOLLOWERS_COUNT).map(CountParser::parse).orElse(null);
    }

    @Override
    public int countVisiblePosts() {
        return screen.all(UiElement.PROFILE_POST_ITEM).size();
    }

    @Override
    public List<InboxConversation> inboxConversations() {
        List<InboxConversation> conversations = new ArrayList<>();
        for (ScreenElement element : screen.all(UiElement.INBOX_CONVERSATION_NAME)) {
            String name = element.textOrDescription();
            if (name == null || name.isBlank() || element.bounds() == null) {
                continue;
            }
            conversations.add(new InboxConversation(name.trim(), element.bounds().centerX(), element.bounds().centerY()));
        }
        return conversations;
    }

    private static ScreenElement nearest(List<ScreenElement> candidates, int centerY) {
        ScreenElement best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (ScreenElement candidate : candidates) {
            if (candidate.bounds() == null) {
                continue;
            }
            int distance = Math.abs(candidate.bounds().centerY() - centerY);
            if (distance <= ROW_MATCH_TOLERANCE_PX && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }
}
