package io.github.samzhu.finops.dto;

import java.time.LocalDate;

/**
 * 成本紀錄查詢條件，所有欄位皆為選填。
 *
 * @param service 服務名稱 (完全比對)
 * @param project 專案 ID (完全比對)
 * @param sku SKU 名稱 (完全比對)
 * @param startDate 起日 (包含)
 * @param endDate 迄日 (包含)
 */
public record CostRecordFilter(
    String service,
    String project,
    String sku,
    LocalDate startDate,
    LocalDate endDate
) {
    public static CostRecordFilter none() {
        return new CostRecordFilter(null, null, null, null, null);
    }

    public static CostRecordFilter forProject(String project) {
        return new CostRecordFilter(null, project, null, null, null);
    }
}
