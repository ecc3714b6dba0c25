package io.github.samzhu.finops.controller;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.finops.client.warehouse.DatasetPage;
import io.github.samzhu.finops.dto.IngestionRequest;
import io.github.samzhu.finops.dto.IngestionResult;
import io.github.samzhu.finops.service.BillingIngestionService;
import io.github.samzhu.finops.service.WarehouseExplorerService;

/**
 * BigQuery 瀏覽與帳單匯入 API 控制器。
 *
 * <p>所有端點都會呼叫 BigQuery，回傳 {@link CompletableFuture}，在 {@code warehouseExecutor} 上執行。
 */
@RestController
@RequestMapping("/api/v1/finops/bigquery")
public class WarehouseApiController {

    private static final Logger log = LoggerFactory.getLogger(WarehouseApiController.class);

    private final WarehouseExplorerService explorerService;
    private final BillingIngestionService ingestionService;

    public WarehouseApiController(WarehouseExplorerService explorerService,
                                  BillingIngestionService ingestionService) {
        this.explorerService = explorerService;
        this.ingestionService = ingestionService;
    }

    // ========== 瀏覽 ==========

    @GetMapping("/datasets")
    public CompletableFuture<ResponseEntity<DatasetPage>> listDatasets(
            @RequestParam(defaultValue = "50") int pageSize,
            @RequestParam(required = false) String pageToken) {
        return explorerService.listDatasets(pageSize, pageToken).thenApply(ResponseEntity::ok);
    }

    @GetMapping("/datasets/{datasetId}/tables")
    public CompletableFuture<ResponseEntity<List<String>>> listTables(@PathVariable String datasetId) {
        return explorerService.listTables(datasetId).thenApply(ResponseEntity::ok);
    }

    @GetMapping("/datasets/{datasetId}/tables/{tableId}/data")
    public CompletableFuture<ResponseEntity<List<Map<String, Object>>>> previewTable(
            @PathVariable String datasetId,
            @PathVariable String tableId,
            @RequestParam(defaultValue = "100") int limit) {
        return explorerService.previewTable(datasetId, tableId, limit).thenApply(ResponseEntity::ok);
    }

    // ========== 匯入 ==========

    /**
     * 從帳單匯出表匯入每日成本。
     *
     * @param datasetId 資料集 ID
     * @param tableId 資料表 ID
     * @param startDate 起日 (包含)，可省略
     * @param endDate 迄日 (包含)，可省略
     */
    @PostMapping("/ingest-billing-data")
    public CompletableFuture<ResponseEntity<IngestionResult>> ingestBillingData(
            @RequestParam String datasetId,
            @RequestParam String tableId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        log.info("Ingestion requested: dataset={}, table={}, start={}, end={}", datasetId, tableId, startDate, endDate);
        return ingestionService.ingestAsync(new IngestionRequest(datasetId, tableId, startDate, endDate))
            .thenApply(ResponseEntity::ok);
    }
}
