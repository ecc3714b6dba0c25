package io.github.samzhu.finops.service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.client.warehouse.DatasetPage;
import io.github.samzhu.finops.client.warehouse.WarehouseClient;
import io.github.samzhu.finops.client.warehouse.WarehouseIdentifiers;
import io.github.samzhu.finops.client.warehouse.WarehouseQuery;

/**
 * 倉儲瀏覽服務。
 *
 * <p>列出資料集與資料表，並提供資料表內容預覽，協助找出帳單匯出表。
 * 所有呼叫都在 {@code warehouseExecutor} 上執行。
 */
@Service
public class WarehouseExplorerService {

    private static final Logger log = LoggerFactory.getLogger(WarehouseExplorerService.class);

    public static final int MAX_PREVIEW_ROWS = 1000;
    public static final int MAX_DATASET_PAGE_SIZE = 1000;

    private final WarehouseClient warehouseClient;
    private final Executor executor;

    public WarehouseExplorerService(WarehouseClient warehouseClient,
                                    @Qualifier("warehouseExecutor") Executor executor) {
        this.warehouseClient = warehouseClient;
        this.executor = executor;
    }

    public CompletableFuture<DatasetPage> listDatasets(int pageSize, String pageToken) {
        if (pageSize < 1 || pageSize > MAX_DATASET_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_DATASET_PAGE_SIZE);
        }
        return CompletableFuture.supplyAsync(() -> warehouseClient.listDatasets(pageSize, pageToken), executor);
    }

    public CompletableFuture<List<String>> listTables(String datasetId) {
        WarehouseIdentifiers.requireDataset(datasetId);
        return CompletableFuture.supplyAsync(() -> warehouseClient.listTables(datasetId), executor);
    }

    /**
     * 預覽資料表的前 {@code limit} 列。
     *
     * @param limit 1 到 {@value #MAX_PREVIEW_ROWS}
     */
    public CompletableFuture<List<Map<String, Object>>> previewTable(String datasetId, String tableId, int limit) {
        if (limit < 1 || limit > MAX_PREVIEW_ROWS) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PREVIEW_ROWS);
        }
        String table = WarehouseIdentifiers.qualifiedTable(warehouseClient.projectId(), datasetId, tableId);
        WarehouseQuery query = WarehouseQuery.of("SELECT * FROM " + table + " LIMIT " + limit);

        return CompletableFuture.supplyAsync(() -> {
            List<Map<String, Object>> rows = warehouseClient.runQuery(query);
            log.debug("Table preview: table={}, rows={}", table, rows.size());
            return rows;
        }, executor);
    }
}
