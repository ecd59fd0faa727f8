package com.jreinhal.formulator.controller;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jreinhal.formulator.exception.GlobalExceptionHandler;
import com.jreinhal.formulator.execution.ExecutionResult;
import com.jreinhal.formulator.llm.LlmInvocationException;
import com.jreinhal.formulator.mcts.SearchReport;
import com.jreinhal.formulator.service.FormulationSearchService;
import com.jreinhal.formulator.service.SearchOutcome;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class FormulationControllerTest {

    private FormulationSearchService searchService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        searchService = mock(FormulationSearchService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new FormulationController(searchService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static SearchOutcome outcome(Boolean correct) {
        SearchReport report = new SearchReport(new ExecutionResult(true, "42\n", ""), Boolean.TRUE.equals(correct), 9,
                List.of(new SearchReport.IterationRecord(1, false, 1.0, 0.0, true, 9)));
        return new SearchOutcome(report, 42.0, correct);
    }

    @Test
    @DisplayName("Should return the search result with its trace")
    void shouldReturnResult() throws Exception {
        when(searchService.search(eq("Maximize x"), eq(42.0))).thenReturn(outcome(true));

        mockMvc.perform(post("/api/formulation/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\":\"Maximize x\",\"expectedAnswer\":42}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.output").value("42\n"))
                .andExpect(jsonPath("$.predictedAnswer").value(42.0))
                .andExpect(jsonPath("$.correct").value(true))
                .andExpect(jsonPath("$.foundCorrect").value(true))
                .andExpect(jsonPath("$.iterations").value(1))
                .andExpect(jsonPath("$.treeSize").value(9))
                .andExpect(jsonPath("$.trace[0].reward").value(1.0))
                .andExpect(jsonPath("$.trace[0].skipped").value(false));
    }

    @Test
    @DisplayName("Should omit correctness without an expected answer")
    void shouldReturnNullCorrectness() throws Exception {
        when(searchService.search(eq("Maximize x"), isNull())).thenReturn(outcome(null));

        mockMvc.perform(post("/api/formulation/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\":\"Maximize x\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correct").value(nullValue()));
    }

    @Test
    @DisplayName("Should map validation errors to 400")
    void shouldMapBadRequest() throws Exception {
        when(searchService.search(any(), any()))
                .thenThrow(new IllegalArgumentException("Problem statement is required"));

        mockMvc.perform(post("/api/formulation/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Problem statement is required"));
    }

    @Test
    @DisplayName("Should map an exhausted language model to 503")
    void shouldMapLlmFailure() throws Exception {
        when(searchService.search(anyString(), any()))
                .thenThrow(new LlmInvocationException("Text generation failed after 8 attempts", true));

        mockMvc.perform(post("/api/formulation/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\":\"Maximize x\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Language model unavailable"));
    }

    @Test
    @DisplayName("Should hide unexpected failures behind a 500")
    void shouldMapUnexpectedFailure() throws Exception {
        when(searchService.search(anyString(), any())).thenThrow(new IllegalStateException("tree corrupted"));

        mockMvc.perform(post("/api/formulation/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\":\"Maximize x\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal server error"));
    }

    @Test
    @DisplayName("Should reject a malformed body")
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/formulation/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"problem\":"))
                .andExpect(status().isBadRequest());
    }
}
