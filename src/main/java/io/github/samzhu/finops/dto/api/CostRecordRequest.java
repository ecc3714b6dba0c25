package io.github.samzhu.finops.dto.api;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import io.github.samzhu.finops.document.CostRecord;

/**
 * 手動提交成本紀錄請求，以自然鍵 upsert。
 *
 * @param service 服務名稱
 * @param project 專案 ID
 * @param sku SKU 名稱
 * @param timePeriod 成本日期
 * @param cost 成本
 * @param currency 幣別，未指定時為 USD
 * @param usageAmount 用量，可為 null
 * @param usageUnit 用量單位，可為 null
 */
public record CostRecordRequest(
    @NotBlank String service,
    @NotBlank String project,
    @NotBlank String sku,
    @NotNull LocalDate timePeriod,
    @NotNull BigDecimal cost,
    String currency,
    BigDecimal usageAmount,
    String usageUnit
) {
    public CostRecord toRecord() {
        return CostRecord.of(service, project, sku, timePeriod, cost, currency, usageAmount, usageUnit);
    }
}
