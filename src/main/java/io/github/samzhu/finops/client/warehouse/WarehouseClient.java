package io.github.samzhu.finops.client.warehouse;

import java.util.List;
import java.util.Map;

/**
 * 欄式資料倉儲的存取能力。
 *
 * <p>實作需保證：
 * <ul>
 *   <li>識別字錯誤或無權限 → {@link io.github.samzhu.finops.exception.ConfigurationException}</li>
 *   <li>其他失敗 (逾時、5xx) → {@link io.github.samzhu.finops.exception.WarehouseException}</li>
 * </ul>
 *
 * <p>查詢結果每列以欄位名稱對應 Java 值 ({@code String}、{@code BigDecimal}、
 * {@code Long}、{@code Boolean}、{@code LocalDate}、{@code Instant})，NULL 值保留為 null。
 */
public interface WarehouseClient {

    /**
     * 目前使用的專案 ID。
     */
    String projectId();

    /**
     * 執行參數化查詢並回傳全部結果列。
     */
    List<Map<String, Object>> runQuery(WarehouseQuery query);

    /**
     * 分頁列出資料集。
     *
     * @param pageSize 每頁筆數
     * @param pageToken 上一頁回傳的 token，第一頁為 null
     */
    DatasetPage listDatasets(int pageSize, String pageToken);

    /**
     * 列出資料集中的所有資料表 ID。
     */
    List<String> listTables(String datasetId);

    /**
     * 檢查資料表是否具有指定欄位 (包含分區虛擬欄位)。
     */
    boolean columnExists(String datasetId, String tableId, String column);
}
