package io.github.samzhu.finops.dto;

import java.time.Instant;

/**
 * 洞察查詢條件，所有欄位皆為選填。
 *
 * @param insightType 洞察類型
 * @param relatedCostRecordId 關聯的成本紀錄 ID
 * @param startTime 洞察時間下界 (包含)
 * @param endTime 洞察時間上界 (包含)
 */
public record InsightFilter(
    String insightType,
    String relatedCostRecordId,
    Instant startTime,
    Instant endTime
) {}
