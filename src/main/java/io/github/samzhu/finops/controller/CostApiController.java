package io.github.samzhu.finops.controller;

import java.time.LocalDate;
import java.util.List;

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

import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.dto.CostRecordFilter;
import io.github.samzhu.finops.dto.CostRecordPage;
import io.github.samzhu.finops.dto.SpendOverview;
import io.github.samzhu.finops.dto.api.CostRecordRequest;
import io.github.samzhu.finops.exception.RecordNotFoundException;
import io.github.samzhu.finops.service.CostRecordStore;
import io.github.samzhu.finops.service.MetricsService;

/**
 * 成本紀錄與支出指標 API 控制器。
 */
@RestController
@RequestMapping("/api/v1/finops")
public class CostApiController {

    private static final Logger log = LoggerFactory.getLogger(CostApiController.class);

    private final CostRecordStore store;
    private final MetricsService metricsService;

    public CostApiController(CostRecordStore store, MetricsService metricsService) {
        this.store = store;
        this.metricsService = metricsService;
    }

    // ========== 成本紀錄 ==========

    /**
     * 以自然鍵寫入單筆成本紀錄。
     */
    @PostMapping("/aggregated-cost")
    public ResponseEntity<CostRecord> upsertCostRecord(@RequestBody @Validated CostRecordRequest request) {
        log.info("Upserting cost record: service={}, project={}, sku={}, timePeriod={}",
            request.service(), request.project(), request.sku(), request.timePeriod());
        return ResponseEntity.status(HttpStatus.CREATED).body(store.upsert(request.toRecord()));
    }

    @GetMapping("/aggregated-cost/{id}")
    public ResponseEntity<CostRecord> getCostRecord(@PathVariable String id) {
        return store.findById(id)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new RecordNotFoundException("cost_records", id));
    }

    /**
     * 條件查詢成本紀錄。
     *
     * @param skip 略過筆數
     * @param limit 每頁上限 (1-1000)
     * @param includeTotal 是否回傳分頁前總筆數
     */
    @GetMapping("/aggregated-cost")
    public ResponseEntity<CostRecordPage> listCostRecords(
            @RequestParam(required = false) String service,
            @RequestParam(required = false) String project,
            @RequestParam(required = false) String sku,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "false") boolean includeTotal) {

        log.debug("Listing cost records: service={}, project={}, sku={}, start={}, end={}, skip={}, limit={}",
            service, project, sku, startDate, endDate, skip, limit);

        CostRecordFilter filter = new CostRecordFilter(service, project, sku, startDate, endDate);
        return ResponseEntity.ok(store.find(filter, skip, limit, includeTotal));
    }

    @GetMapping("/services")
    public ResponseEntity<List<String>> getServices() {
        return ResponseEntity.ok(store.distinctServices());
    }

    @GetMapping("/projects")
    public ResponseEntity<List<String>> getProjects() {
        return ResponseEntity.ok(store.distinctProjects());
    }

    @GetMapping("/skus")
    public ResponseEntity<List<String>> getSkus() {
        return ResponseEntity.ok(store.distinctSkus());
    }

    // ========== 支出指標 ==========

    /**
     * 取得支出概況 (月累計、燃燒率、月底預估)。
     *
     * @param project 專案 ID，未指定時為全部專案
     * @param windowDays 燃燒率回溯天數，未指定時使用設定值
     */
    @GetMapping("/overview")
    public ResponseEntity<SpendOverview> getOverview(
            @RequestParam(required = false) String project,
            @RequestParam(required = false) @Min(1) @Max(366) Integer windowDays) {
        return ResponseEntity.ok(metricsService.overview(project, windowDays));
    }
}
