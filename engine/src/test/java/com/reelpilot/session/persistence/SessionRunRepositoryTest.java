package com.reelpilot.session.persistence;

import com.reelpilot.session.model.ScrapedProfile;
import com.reelpilot.session.model.WorkflowSessionView;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SessionRunRepositoryTest {

    @Autowired
    private SessionRunRepository sessions;

    @Autowired
    private ScrapedProfileRepository profiles;

    @Test
    void completedSessionKeepsItsStats() {
        Instant startedAt = Instant.now();
        long id = sessions.insertSession("default", "FEED", null, "{\"maxTargets\":5}", startedAt);

        WorkflowSessionView running = sessions.findSession(id);
        assertEquals("RUNNING", running.status());
        assertNull(running.finishedAt());

        sessions.completeSession(id, "COMPLETED", "max_videos_reached", "{\"videos_watched\":5}", startedAt.plusSeconds(30));

        WorkflowSessionView done = sessions.findSession(id);
        assertEquals("COMPLETED", done.status());
        assertEquals("max_videos_reached", done.completionReason());
        assertNotNull(done.finishedAt());
        assertEquals(5, ((Number) done.stats().get("videos_watched")).intValue());
        assertTrue(sessions.findRecentSessions(10).stream().anyMatch(view -> view.id() == id));
    }

    @Test
    void unknownSessionIsNull() {
        assertNull(sessions.findSession(-1L));
    }

    @Test
    void enrichedProfileReplacesListRow() {
        long id = sessions.insertSession("default", "SCRAPER", "followers:@alice", "{}", Instant.now());
        ScrapedProfile listRow = new ScrapedProfile("bob", "Bob", null, null, null, null, false, false, "followers:@alice", false, Instant.now());
        ScrapedProfile enriched = new ScrapedProfile("bob", "Bob B", 1200L, 10L, 99L, "hi", false, true, "followers:@alice", true, Instant.now());

        profiles.upsert(id, listRow);
        profiles.upsert(id, enriched);

        List<ScrapedProfile> stored = profiles.findBySession(id);
        assertEquals(1, stored.size());
        assertEquals(1200L, stored.get(0).followersCount());
        assertTrue(stored.get(0).enriched());
        assertTrue(stored.get(0).verified());
    }
}
