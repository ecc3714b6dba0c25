package io.github.samzhu.finops.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 洞察紀錄文件。
 *
 * <p>每次產生或手動提交洞察時建立一筆，之後不再修改。
 * {@code insightType} 為開放集合，常見值：
 * {@code summary}、{@code spend_summary}、{@code anomaly}、{@code root_cause}、
 * {@code prediction}、{@code recommendation}、{@code natural_query}。
 *
 * <p>{@code relatedCostRecordId} 是指向 {@link CostRecord} 的弱連結，不做串聯刪除。
 *
 * @param id MongoDB ObjectId
 * @param insightType 洞察類型
 * @param insightText 洞察內容
 * @param relatedCostRecordId 關聯的成本紀錄 ID，可為 null
 * @param sentiment 情緒標記 (如 positive / negative / neutral)，可為 null
 * @param timestamp 洞察時間
 * @param createdAt 建立時間
 * @param updatedAt 更新時間 (建立後與 createdAt 相同)
 */
@Document(collection = "insight_records")
public record InsightRecord(
    @Id String id,
    @Indexed String insightType,
    String insightText,
    @Indexed String relatedCostRecordId,
    String sentiment,
    @Indexed Instant timestamp,
    Instant createdAt,
    Instant updatedAt
) {
    /**
     * 建立尚未持久化的洞察紀錄。
     */
    public static InsightRecord create(String insightType, String insightText,
                                       String relatedCostRecordId, String sentiment, Instant now) {
        return new InsightRecord(null, insightType, insightText, relatedCostRecordId, sentiment,
            now, now, now);
    }
}
