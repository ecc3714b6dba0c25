package io.github.samzhu.finops.dto;

import io.github.samzhu.finops.service.FilterColumn;

/**
 * 帳單匯入結果。
 *
 * @param datasetId 資料集 ID
 * @param tableId 資料表 ID
 * @param filterColumn 本次使用的日期過濾欄位
 * @param rowsFetched 倉儲回傳的聚合列數
 * @param recordsPersisted 寫入的紀錄數 (依自然鍵去重後)
 * @param durationMs 耗時 (毫秒)
 */
public record IngestionResult(
    String datasetId,
    String tableId,
    FilterColumn filterColumn,
    int rowsFetched,
    int recordsPersisted,
    long durationMs
) {}
