package io.github.samzhu.finops.service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.client.warehouse.WarehouseClient;
import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.dto.IngestionRequest;
import io.github.samzhu.finops.dto.IngestionResult;

/**
 * 帳單匯入服務。
 *
 * <p>處理流程：
 * <ol>
 *   <li>{@link BillingQueryBuilder} 探測資料表並產生聚合查詢</li>
 *   <li>{@link WarehouseClient} 執行查詢</li>
 *   <li>{@link CostRecordTransformer} 轉換全部資料列 (任一列失敗即中止)</li>
 *   <li>{@link CostRecordStore} 在單一交易中批次 upsert</li>
 * </ol>
 *
 * <p>任何步驟失敗時不會寫入任何紀錄，例外原樣往上拋出，可安全地整批重跑。
 */
@Service
public class BillingIngestionService {

    private static final Logger log = LoggerFactory.getLogger(BillingIngestionService.class);

    private final BillingQueryBuilder queryBuilder;
    private final WarehouseClient warehouseClient;
    private final CostRecordTransformer transformer;
    private final CostRecordStore store;
    private final Executor executor;

    public BillingIngestionService(
            BillingQueryBuilder queryBuilder,
            WarehouseClient warehouseClient,
            CostRecordTransformer transformer,
            CostRecordStore store,
            @Qualifier("warehouseExecutor") Executor executor) {
        this.queryBuilder = queryBuilder;
        this.warehouseClient = warehouseClient;
        this.transformer = transformer;
        this.store = store;
        this.executor = executor;
    }

    /**
     * 執行一次帳單匯入。
     *
     * @param request 匯入請求
     * @return 匯入結果
     */
    public IngestionResult ingest(IngestionRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Billing ingestion started: dataset={}, table={}, start={}, end={}",
            request.datasetId(), request.tableId(), request.startDate(), request.endDate());

        BillingQueryBuilder.BillingQuery billingQuery = queryBuilder.build(
            request.datasetId(), request.tableId(), request.startDate(), request.endDate());

        List<Map<String, Object>> rows = warehouseClient.runQuery(billingQuery.query());
        List<CostRecord> records = transformer.transformAll(rows);
        List<CostRecord> persisted = store.bulkUpsert(records);

        long duration = System.currentTimeMillis() - startTime;
        log.info("Billing ingestion completed: dataset={}, table={}, filterColumn={}, rows={}, persisted={} in {}ms",
            request.datasetId(), request.tableId(), billingQuery.filterColumn(), rows.size(), persisted.size(), duration);

        return new IngestionResult(request.datasetId(), request.tableId(), billingQuery.filterColumn(),
            rows.size(), persisted.size(), duration);
    }

    /**
     * 在 {@code warehouseExecutor} 上執行匯入。
     */
    public CompletableFuture<IngestionResult> ingestAsync(IngestionRequest request) {
        return CompletableFuture.supplyAsync(() -> ingest(request), executor);
    }
}
