package com.reelpilot.session.service;

import com.reelpilot.config.SessionProperties;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.ScrapeSource;
import com.reelpilot.session.model.WorkflowType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SessionCliRunnerTest {

    @Test
    void targetsAreSplitAndTrimmed() {
        SessionProperties properties = new SessionProperties();
        properties.getCli().setWorkflow("followers");
        properties.getCli().setTargets("a1, b2,, ");

        RunConfig config = SessionCliRunner.buildConfig(properties);

        assertEquals(WorkflowType.FOLLOWERS, config.workflowType());
        assertEquals(List.of("a1", "b2"), config.targetUsernames());
    }

    @Test
    void scraperWithHashtagScrapesHashtagAuthors() {
        SessionProperties properties = new SessionProperties();
        properties.getCli().setWorkflow("Scraper");
        properties.getCli().setHashtag("cats");

        RunConfig config = SessionCliRunner.buildConfig(properties);

        assertEquals(ScrapeSource.HASHTAG, config.scrapeSource());
        assertEquals("cats", config.hashtag());
    }

    @Test
    void configuredDefaultsFlowIntoTheRun() {
        SessionProperties properties = new SessionProperties();
        properties.getDefaults().setLikeProbability(0.75);
        properties.getRecovery().setMaxErrors(9);

        RunConfig config = SessionCliRunner.buildConfig(properties);

        assertEquals(WorkflowType.FEED, config.workflowType());
        assertEquals(0.75, config.likeProbability());
        assertEquals(9, config.maxErrors());
        assertEquals(ScrapeSource.FOLLOWERS, config.scrapeSource());
    }

    @Test
    void unknownWorkflowIsRejected() {
        SessionProperties properties = new SessionProperties();
        properties.getCli().setWorkflow("livestream");

        assertThrows(IllegalArgumentException.class, () -> SessionCliRunner.buildConfig(properties));
    }
}
