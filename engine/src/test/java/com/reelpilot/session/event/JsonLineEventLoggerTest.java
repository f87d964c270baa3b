package com.reelpilot.session.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonLineEventLoggerTest {

    @Test
    void eventIsWrappedInTypeAndData() throws Exception {
        JsonLineEventLogger logger = new JsonLineEventLogger(new ObjectMapper());
        Map<String, Object> video = new LinkedHashMap<>();
        video.put("author", "alice");
        video.put("likes", 1200);

        assertEquals(
            "{\"type\":\"video\",\"data\":{\"author\":\"alice\",\"likes\":1200}}",
            logger.toLine("video", video)
        );
    }
}
