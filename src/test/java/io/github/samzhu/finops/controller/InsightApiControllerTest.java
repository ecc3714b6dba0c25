package io.github.samzhu.finops.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import io.github.samzhu.finops.document.InsightRecord;
import io.github.samzhu.finops.dto.api.InsightRequest;
import io.github.samzhu.finops.exception.GenerationException;
import io.github.samzhu.finops.service.InsightService;

@WebMvcTest(InsightApiController.class)
class InsightApiControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-20T08:30:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InsightService insightService;

    @Test
    void shouldGenerateInsight() throws Exception {
        // Given
        when(insightService.generate(any(InsightRequest.class))).thenReturn(CompletableFuture.completedFuture(
            InsightRecordFixture.saved("anomaly", "No anomalies detected.")));

        // When
        MvcResult result = mockMvc.perform(post("/api/v1/finops/ai-insight")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"insightType\": \"anomaly\", \"project\": \"proj-a\"}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        // Then
        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.insightType").value("anomaly"))
            .andExpect(jsonPath("$.insightText").value("No anomalies detected."));
    }

    @Test
    void shouldMapGenerationFailureToBadGateway() throws Exception {
        when(insightService.generate(any(InsightRequest.class))).thenReturn(CompletableFuture.failedFuture(
            new GenerationException("summary", "backend returned no response candidates (finishReason=SAFETY)")));

        MvcResult result = mockMvc.perform(post("/api/v1/finops/ai-insight")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.title").value("Insight Generation Failure"))
            .andExpect(jsonPath("$.insightType").value("summary"));
    }

    @Test
    void shouldRejectNaturalQueryWithoutQuery() throws Exception {
        when(insightService.generate(any(InsightRequest.class)))
            .thenThrow(new IllegalArgumentException("query is required for insight type natural_query"));

        mockMvc.perform(post("/api/v1/finops/ai-insight")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"insightType\": \"natural_query\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnNotFoundForUnknownInsight() throws Exception {
        when(insightService.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/finops/llm-insight/nope"))
            .andExpect(status().isNotFound());
    }

    private static final class InsightRecordFixture {

        static InsightRecord saved(String type, String text) {
            return new InsightRecord("insight-1", type, text, null, null, NOW, NOW, NOW);
        }
    }
}
