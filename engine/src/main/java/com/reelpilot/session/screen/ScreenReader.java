package com.reelpilot.session.screen;

import com.reelpilot.session.model.InboxConversation;
import com.reelpilot.session.model.ListRow;
import com.reelpilot.session.model.ProfileSnapshot;
import com.reelpilot.session.model.VideoDetails;

import java.util.List;
import java.util.Optional;

/**
 * Read-only extraction of structured data from the current screen.
 */
public interface ScreenReader {

    Optional<VideoDetails> readCurrentVideo();

    List<ListRow> visibleRows();

    ProfileSnapshot readProfile();

    Long readFollowersCount();

    int countVisiblePosts();

    List<InboxConversation> inboxConversations();
}
