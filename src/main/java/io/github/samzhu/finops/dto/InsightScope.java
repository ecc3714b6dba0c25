package io.github.samzhu.finops.dto;

import java.time.LocalDate;

/**
 * 洞察的資料範圍，所有欄位皆為選填。
 *
 * @param project 專案 ID
 * @param service 服務名稱
 * @param sku SKU 名稱
 * @param startDate 起日 (包含)
 * @param endDate 迄日 (包含)
 */
public record InsightScope(
    String project,
    String service,
    String sku,
    LocalDate startDate,
    LocalDate endDate
) {
    public static InsightScope unscoped() {
        return new InsightScope(null, null, null, null, null);
    }

    public boolean isEmpty() {
        return project == null && service == null && sku == null && startDate == null && endDate == null;
    }

    public CostRecordFilter toFilter() {
        return new CostRecordFilter(service, project, sku, startDate, endDate);
    }
}
