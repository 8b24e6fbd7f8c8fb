package com.anxietycompanion.controller;

import com.anxietycompanion.exception.GlobalExceptionHandler;
import com.anxietycompanion.service.AnxietyAnalysisService;
import com.anxietycompanion.service.ClaudeAnalysisClient;
import com.anxietycompanion.service.HeuristicAnxietyClassifier;
import com.anxietycompanion.model.domain.AnalysisFailure;
import com.anxietycompanion.model.domain.RemoteAnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AnalysisControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ClaudeAnalysisClient remoteClient = mock(ClaudeAnalysisClient.class);
        when(remoteClient.call(any(), any()))
                .thenReturn(RemoteAnalysisResult.failure(AnalysisFailure.REMOTE_UNAVAILABLE, "offline"));
        AnxietyAnalysisService service = new AnxietyAnalysisService(remoteClient, new HeuristicAnxietyClassifier());
        mockMvc = MockMvcBuilders.standaloneSetup(new AnalysisController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldAnalyzeWithLocalFallback() throws Exception {
        mockMvc.perform(post("/api/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"I keep seeing things\",\"recentHistory\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anxietyLevel").value(10))
                .andExpect(jsonPath("$.source").value("fallback"))
                .andExpect(jsonPath("$.crisisRisk").value("critical"))
                .andExpect(jsonPath("$.category").value("hallucination"));
    }

    @Test
    void shouldRejectMissingMessage() throws Exception {
        mockMvc.perform(post("/api/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recentHistory\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }
}
