package com.reelpilot.session.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes every event as one JSON object per line on the {@code reelpilot.events} logger, the
 * stream a desktop bridge tails.
 */
@Component
public class JsonLineEventLogger implements WorkflowEventListener {
    private static final Logger events = LoggerFactory.getLogger("reelpilot.events");
    private static final Logger log = LoggerFactory.getLogger(JsonLineEventLogger.class);

    private final ObjectMapper objectMapper;

    public JsonLineEventLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void onStats(Map<String, Object> stats) {
        write("stats", stats);
    }

    @Override
    public void onAction(Map<String, Object> action) {
        write("action", action);
    }

    @Override
    public void onPause(int seconds) {
        write("pause", Map.of("seconds", seconds));
    }

    @Override
    public void onVideo(Map<String, Object> video) {
        write("video", video);
    }

    String toLine(String type, Map<String, Object> payload) throws JsonProcessingException {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", type);
        envelope.put("data", payload);
        return objectMapper.writeValueAsString(envelope);
    }

    private void write(String type, Map<String, Object> payload) {
        try {
            events.info(toLine(type, payload));
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialize {} event", type, e);
        }
    }
}
