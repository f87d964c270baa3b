package com.reelpilot.session.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelpilot.session.model.CompletionReason;
import com.reelpilot.session.model.RunConfig;
import com.reelpilot.session.model.ScrapedProfile;
import com.reelpilot.session.model.Stats;
import com.reelpilot.session.persistence.ScrapedProfileRepository;
import com.reelpilot.session.persistence.SessionRunRepository;
import com.reelpilot.session.workflow.SessionJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;

@Component
public class JdbcSessionJournal implements SessionJournal {
    private static final Logger log = LoggerFactory.getLogger(JdbcSessionJournal.class);

    private final SessionRunRepository sessionRepository;
    private final ScrapedProfileRepository profileRepository;
    private final ObjectMapper objectMapper;

    public JdbcSessionJournal(
        SessionRunRepository sessionRepository,
        ScrapedProfileRepository profileRepository,
        ObjectMapper objectMapper
    ) {
        this.sessionRepository = sessionRepository;
        this.profileRepository = profileRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Long open(RunConfig config) {
        return sessionRepository.insertSession(
            config.accountId(),
            config.workflowType().name().toLowerCase(Locale.ROOT),
            config.scope(),
            toJson(config),
            Instant.now()
        );
    }

    @Override
    public void close(Long sessionId, Stats stats) {
        if (sessionId == null) {
            return;
        }
        CompletionReason reason = stats.completionReason();
        sessionRepository.completeSession(
            sessionId,
            statusFor(reason),
            reason == null ? null : reason.code(),
            toJson(stats.toMap()),
            stats.finishedAt() == null ? Instant.now() : stats.finishedAt()
        );
    }

    @Override
    public void saveProfile(Long sessionId, ScrapedProfile profile) {
        if (sessionId == null) {
            log.debug("No session row; scraped profile @{} not stored", profile.username());
            return;
        }
        profileRepository.upsert(sessionId, profile);
    }

    static String statusFor(CompletionReason reason) {
        if (reason == null) {
            return "FAILED";
        }
        return switch (reason) {
            case STOPPED_BY_USER -> "STOPPED";
            case ERROR, RECOVERY_FAILED, NAVIGATION_FAILED -> "FAILED";
            default -> "COMPLETED";
        };
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize {}", value.getClass().getSimpleName(), e);
            return null;
        }
    }
}
