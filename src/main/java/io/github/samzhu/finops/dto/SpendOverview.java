package io.github.samzhu.finops.dto;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 支出概況。
 *
 * @param project 專案 ID，null 表示全部專案
 * @param period 當前月份，如 "2025-01"
 * @param asOf 計算基準時間
 * @param windowDays 燃燒率回溯天數
 * @param mtdSpend 月累計支出
 * @param burnRateEstimatedMonthly 以回溯視窗平均推估的月支出 (日均 × 30)
 * @param dailyBurnRateMtd 本月日均支出
 * @param projectedMonthEndSpend 月底預估支出
 * @param daysElapsed 本月已過天數 (含當天)
 * @param daysRemaining 本月剩餘天數 (不含當天)
 */
public record SpendOverview(
    String project,
    String period,
    Instant asOf,
    int windowDays,
    BigDecimal mtdSpend,
    BigDecimal burnRateEstimatedMonthly,
    BigDecimal dailyBurnRateMtd,
    BigDecimal projectedMonthEndSpend,
    int daysElapsed,
    int daysRemaining
) {}
