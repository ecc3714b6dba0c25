package io.github.samzhu.finops.controller;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import io.github.samzhu.finops.document.InsightRecord;
import io.github.samzhu.finops.dto.InsightFilter;
import io.github.samzhu.finops.dto.api.InsightCreateRequest;
import io.github.samzhu.finops.dto.api.InsightRequest;
import io.github.samzhu.finops.exception.RecordNotFoundException;
import io.github.samzhu.finops.service.InsightService;

/**
 * 洞察 API 控制器。
 *
 * <p>產生類端點回傳 {@link CompletableFuture}，生成後端呼叫在 {@code insightExecutor} 上執行。
 */
@RestController
@RequestMapping("/api/v1/finops")
public class InsightApiController {

    private static final Logger log = LoggerFactory.getLogger(InsightApiController.class);

    private final InsightService insightService;

    public InsightApiController(InsightService insightService) {
        this.insightService = insightService;
    }

    // ========== 洞察產生 ==========

    /**
     * 依洞察類型與範圍產生洞察。
     */
    @PostMapping("/ai-insight")
    public CompletableFuture<ResponseEntity<InsightRecord>> generateInsight(
            @RequestBody @Validated InsightRequest request) {
        log.info("Generating insight: type={}, project={}, service={}, sku={}",
            request.insightType(), request.project(), request.service(), request.sku());
        return insightService.generate(request)
            .thenApply(record -> ResponseEntity.status(HttpStatus.CREATED).body(record));
    }

    /**
     * 產生支出摘要。
     */
    @PostMapping("/generate-spend-summary")
    public CompletableFuture<ResponseEntity<InsightRecord>> generateSpendSummary(
            @RequestParam(required = false) String project,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        log.info("Generating spend summary: project={}, start={}, end={}", project, startDate, endDate);
        return insightService.generateSpendSummary(project, startDate, endDate)
            .thenApply(record -> ResponseEntity.status(HttpStatus.CREATED).body(record));
    }

    // ========== 手動提交與查詢 ==========

    @PostMapping("/llm-insight")
    public ResponseEntity<InsightRecord> createInsight(@RequestBody @Validated InsightCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(insightService.create(request));
    }

    @GetMapping("/llm-insight/{id}")
    public ResponseEntity<InsightRecord> getInsight(@PathVariable String id) {
        return insightService.findById(id)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new RecordNotFoundException("insight_records", id));
    }

    @GetMapping("/llm-insight")
    public ResponseEntity<List<InsightRecord>> listInsights(
            @RequestParam(required = false) String insightType,
            @RequestParam(required = false) String relatedCostRecordId,
            @RequestParam(required = false) Instant startTime,
            @RequestParam(required = false) Instant endTime,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        InsightFilter filter = new InsightFilter(insightType, relatedCostRecordId, startTime, endTime);
        return ResponseEntity.ok(insightService.find(filter, skip, limit));
    }
}
