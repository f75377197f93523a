package com.company.clientpulse.controller;

import com.company.clientpulse.domain.QueueStats;
import com.company.clientpulse.service.EvaluationQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class QueueControllerTest {

    @Mock
    private EvaluationQueue evaluationQueue;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new QueueController(evaluationQueue)).build();
    }

    @Test
    @DisplayName("Should expose the queue counters")
    void shouldReturnStats() throws Exception {
        // Given
        when(evaluationQueue.stats()).thenReturn(QueueStats.builder()
                .running(true)
                .enqueued(12)
                .rejected(3)
                .started(10)
                .succeeded(8)
                .failed(1)
                .notificationsSent(2)
                .inFlight(1)
                .queueDepth(2)
                .workers(4)
                .capacity(100)
                .build());

        // When / Then
        mockMvc.perform(get("/api/v1/queue/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.enqueued").value(12))
                .andExpect(jsonPath("$.rejected").value(3))
                .andExpect(jsonPath("$.notificationsSent").value(2))
                .andExpect(jsonPath("$.queueDepth").value(2))
                .andExpect(jsonPath("$.capacity").value(100));
    }
}
