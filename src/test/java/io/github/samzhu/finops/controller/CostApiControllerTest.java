package io.github.samzhu.finops.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.dto.CostRecordFilter;
import io.github.samzhu.finops.dto.CostRecordPage;
import io.github.samzhu.finops.dto.SpendOverview;
import io.github.samzhu.finops.service.CostRecordStore;
import io.github.samzhu.finops.service.MetricsService;

@WebMvcTest(CostApiController.class)
class CostApiControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-15T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CostRecordStore store;

    @MockBean
    private MetricsService metricsService;

    @Test
    void shouldUpsertCostRecord() throws Exception {
        // Given
        when(store.upsert(any(CostRecord.class))).thenReturn(persisted());

        // When / Then
        mockMvc.perform(post("/api/v1/finops/aggregated-cost")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"service": "Compute Engine", "project": "proj-a", "sku": "N1 Core",
                     "timePeriod": "2025-01-14", "cost": 12.50}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("cost-1"))
            .andExpect(jsonPath("$.timePeriod").value("2025-01-14"))
            .andExpect(jsonPath("$.currency").value("USD"));
    }

    @Test
    void shouldRejectIncompleteCostRecord() throws Exception {
        mockMvc.perform(post("/api/v1/finops/aggregated-cost")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"project\": \"proj-a\", \"cost\": 1}"))
            .andExpect(status().isBadRequest());

        verify(store, never()).upsert(any(CostRecord.class));
    }

    @Test
    void shouldReturnProblemForUnknownId() throws Exception {
        when(store.findById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/finops/aggregated-cost/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.title").value("Not Found"))
            .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void shouldListWithFilterAndPagination() throws Exception {
        // Given
        CostRecordFilter filter = new CostRecordFilter(null, "proj-a", null,
            LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31));
        when(store.find(eq(filter), eq(10), eq(5), eq(true)))
            .thenReturn(new CostRecordPage(List.of(persisted()), 11L, 10, 5));

        // When / Then
        mockMvc.perform(get("/api/v1/finops/aggregated-cost")
                .param("project", "proj-a")
                .param("startDate", "2025-01-01")
                .param("endDate", "2025-01-31")
                .param("skip", "10")
                .param("limit", "5")
                .param("includeTotal", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(11))
            .andExpect(jsonPath("$.records[0].sku").value("N1 Core"));
    }

    @Test
    void shouldListDistinctServices() throws Exception {
        when(store.distinctServices()).thenReturn(List.of("BigQuery", "Compute Engine"));

        mockMvc.perform(get("/api/v1/finops/services"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("BigQuery"))
            .andExpect(jsonPath("$[1]").value("Compute Engine"));
    }

    @Test
    void shouldReturnOverview() throws Exception {
        when(metricsService.overview("proj-a", 7)).thenReturn(new SpendOverview("proj-a", "2025-01", NOW, 7,
            new BigDecimal("200"), new BigDecimal("900"), new BigDecimal("13.33"), new BigDecimal("413.33"), 15, 16));

        mockMvc.perform(get("/api/v1/finops/overview").param("project", "proj-a").param("windowDays", "7"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.period").value("2025-01"))
            .andExpect(jsonPath("$.mtdSpend").value(200))
            .andExpect(jsonPath("$.daysRemaining").value(16));
    }

    @Test
    void shouldMapInvalidWindowToBadRequest() throws Exception {
        when(metricsService.overview(null, null)).thenThrow(new IllegalArgumentException("windowDays must be >= 1, got 0"));

        mockMvc.perform(get("/api/v1/finops/overview"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.title").value("Bad Request"));
    }

    private static CostRecord persisted() {
        return new CostRecord("cost-1", "Compute Engine", "proj-a", "N1 Core", LocalDate.of(2025, 1, 14),
            new BigDecimal("12.50"), "USD", null, null, NOW, NOW);
    }
}
