package io.github.samzhu.finops.document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

/**
 * 每日成本聚合文件。
 *
 * <p>記錄單一 (service, project, SKU) 組合在某個 UTC 日期的支出與用量：
 * <ul>
 *   <li>自然鍵 - {@code (service, project, sku, timePeriod)}，由唯一複合索引保證不重複</li>
 *   <li>金額 - 以 Decimal128 儲存，避免浮點誤差</li>
 *   <li>用量 - {@code usageAmount} / {@code usageUnit} 可能不存在，保留為 null 而非 0</li>
 * </ul>
 *
 * <p>同一自然鍵再次匯入時覆寫 cost、currency、usageAmount、usageUnit、updatedAt；
 * {@code createdAt} 只在第一次寫入時設定。
 *
 * @param id MongoDB ObjectId
 * @param service 服務名稱 (BigQuery {@code service.description})
 * @param project 專案 ID (BigQuery {@code project.id})
 * @param sku SKU 名稱 (BigQuery {@code sku.description})
 * @param timePeriod 成本所屬的 UTC 日期
 * @param cost 當日成本
 * @param currency 幣別，預設 USD
 * @param usageAmount 用量，可能為 null
 * @param usageUnit 用量單位，可能為 null
 * @param createdAt 首次寫入時間
 * @param updatedAt 最後更新時間
 */
@Document(collection = "cost_records")
@CompoundIndexes({
    @CompoundIndex(name = "natural_key_idx", def = "{'service': 1, 'project': 1, 'sku': 1, 'timePeriod': 1}", unique = true),
    @CompoundIndex(name = "project_period_idx", def = "{'project': 1, 'timePeriod': 1}")
})
public record CostRecord(
    @Id String id,
    String service,
    String project,
    String sku,
    LocalDate timePeriod,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal cost,
    String currency,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal usageAmount,
    String usageUnit,
    Instant createdAt,
    Instant updatedAt
) {
    public static final String DEFAULT_CURRENCY = "USD";

    public CostRecord {
        if (currency == null || currency.isBlank()) {
            currency = DEFAULT_CURRENCY;
        }
    }

    /**
     * 建立尚未持久化的紀錄 (無 ID、無時間戳)。
     */
    public static CostRecord of(String service, String project, String sku, LocalDate timePeriod,
                                BigDecimal cost, String currency, BigDecimal usageAmount, String usageUnit) {
        return new CostRecord(null, service, project, sku, timePeriod, cost, currency,
            usageAmount, usageUnit, null, null);
    }

    /**
     * 取得自然鍵。
     */
    public NaturalKey naturalKey() {
        return new NaturalKey(service, project, sku, timePeriod);
    }

    /**
     * 成本紀錄的自然鍵。
     */
    public record NaturalKey(String service, String project, String sku, LocalDate timePeriod) {}
}
