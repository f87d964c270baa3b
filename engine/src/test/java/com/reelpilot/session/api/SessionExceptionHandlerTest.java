package com.reelpilot.session.api;

import com.reelpilot.session.service.ActiveSessionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SessionExceptionHandlerTest {

    @Test
    void activeSessionMapsToConflict() {
        ResponseEntity<Map<String, String>> response = new SessionExceptionHandler()
            .handleActiveSession(new ActiveSessionException("Active session in progress (workflow=FEED, sessionId=4)"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("active_session", response.getBody().get("error"));
        assertEquals("Active session in progress (workflow=FEED, sessionId=4)", response.getBody().get("message"));
    }
}
