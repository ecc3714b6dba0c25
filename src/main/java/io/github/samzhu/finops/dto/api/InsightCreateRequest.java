package io.github.samzhu.finops.dto.api;

import java.time.Instant;

import jakarta.validation.constraints.NotBlank;

/**
 * 手動提交洞察請求。
 *
 * @param insightType 洞察類型
 * @param insightText 洞察內容
 * @param relatedCostRecordId 關聯的成本紀錄 ID，可為 null
 * @param sentiment 情緒標記，可為 null
 * @param timestamp 洞察時間，未指定時為目前時間
 */
public record InsightCreateRequest(
    @NotBlank String insightType,
    @NotBlank String insightText,
    String relatedCostRecordId,
    String sentiment,
    Instant timestamp
) {}
