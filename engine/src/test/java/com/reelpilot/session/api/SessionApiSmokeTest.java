package com.reelpilot.session.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class SessionApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/sessions/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void unknownWorkflowIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/sessions/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflow\":\"livestream\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void followersWorkflowNeedsSearchQuery() throws Exception {
        mockMvc.perform(post("/api/sessions/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"workflow\":\"followers\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void statusIsIdleWithoutARun() throws Exception {
        mockMvc.perform(get("/api/sessions/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.paused").value(false));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        mockMvc.perform(get("/api/sessions/987654"))
            .andExpect(status().isNotFound());
    }

    @Test
    void recentListsAreArrays() throws Exception {
        mockMvc.perform(get("/api/sessions/recent").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());

        mockMvc.perform(get("/api/sessions/interactions/recent"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }
}
