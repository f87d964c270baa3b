package com.reelpilot.session.workflow;

import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.ScrapedProfile;
import com.reelpilot.session.model.Stats;

/**
 * Persists the session envelope (start/finish) and scraped rows.
 */
public interface SessionJournal {
    SessionJournal NONE = new SessionJournal() {
        @Override
        public Long open(RunConfig config) {
            return null;
        }

        @Override
        public void close(Long sessionId, Stats stats) {
        }

        @Override
        public void saveProfile(Long sessionId, ScrapedProfile profile) {
        }
    };

    Long open(RunConfig config);

    void close(Long sessionId, Stats stats);

    void saveProfile(Long sessionId, ScrapedProfile profile);
}
