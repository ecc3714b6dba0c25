package io.github.samzhu.finops.dto.api;

import java.time.LocalDate;

import jakarta.validation.constraints.Size;

import io.github.samzhu.finops.dto.InsightScope;

/**
 * 洞察產生請求。
 *
 * <p>{@code insightType} 為 {@code natural_query} 時 {@code query} 必填。
 *
 * @param query 使用者問題或額外要求
 * @param insightType 洞察類型，未指定時為 {@code summary}
 * @param project 專案 ID
 * @param service 服務名稱
 * @param sku SKU 名稱
 * @param startDate 起日 (包含)
 * @param endDate 迄日 (包含)
 */
public record InsightRequest(
    @Size(max = 2000) String query,
    String insightType,
    String project,
    String service,
    String sku,
    LocalDate startDate,
    LocalDate endDate
) {
    public InsightScope scope() {
        return new InsightScope(project, service, sku, startDate, endDate);
    }
}
