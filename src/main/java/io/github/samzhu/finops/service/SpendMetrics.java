package io.github.samzhu.finops.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;

import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.dto.SpendOverview;
import io.github.samzhu.finops.util.PeriodUtils;

/**
 * 支出指標計算。
 *
 * <p>所有方法皆為 (紀錄, 現在時間) 的純函式，不存取資料庫：
 * <ul>
 *   <li>月累計 (MTD) - {@code timePeriod >= 當月 1 號 (UTC)} 的成本總和，沒有紀錄時為 0</li>
 *   <li>燃燒率 - {@code [now - windowDays, now]} 區間的成本總和 ÷ windowDays × 30</li>
 *   <li>本月日均 - MTD ÷ 本月已過天數 (含當天，至少為 1)</li>
 *   <li>月底預估 - MTD + 本月日均 × 剩餘天數</li>
 * </ul>
 *
 * <p>燃燒率的 × 30 是固定的月份近似值，不隨實際月份天數變動。
 * 幣別不做換算，混合幣別的紀錄直接加總。
 */
public final class SpendMetrics {

    static final BigDecimal DAYS_PER_MONTH = BigDecimal.valueOf(30);
    static final int SCALE = 10;

    private SpendMetrics() {
        // 工具類不允許實例化
    }

    /**
     * 計算月累計支出。
     */
    public static BigDecimal monthToDate(Collection<CostRecord> records, Instant now) {
        LocalDate monthStart = PeriodUtils.monthStart(PeriodUtils.utcDate(now));
        LocalDate nextMonthStart = monthStart.plusMonths(1);
        return records.stream()
            .filter(r -> !r.timePeriod().isBefore(monthStart) && r.timePeriod().isBefore(nextMonthStart))
            .map(CostRecord::cost)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * 計算以回溯視窗推估的月支出。
     *
     * @param windowDays 回溯天數，至少為 1
     * @throws IllegalArgumentException windowDays 小於 1
     */
    public static BigDecimal burnRate(Collection<CostRecord> records, Instant now, int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be >= 1, got " + windowDays);
        }
        Instant windowStart = now.minus(windowDays, ChronoUnit.DAYS);
        BigDecimal total = records.stream()
            .filter(r -> {
                Instant dayStart = PeriodUtils.startOfDay(r.timePeriod());
                return !dayStart.isBefore(windowStart) && !dayStart.isAfter(now);
            })
            .map(CostRecord::cost)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(windowDays), SCALE, RoundingMode.HALF_UP)
            .multiply(DAYS_PER_MONTH);
    }

    /**
     * 計算本月日均支出。
     */
    public static BigDecimal dailyBurnRateMtd(BigDecimal monthToDate, Instant now) {
        int daysElapsed = PeriodUtils.daysElapsedInMonth(PeriodUtils.utcDate(now));
        return monthToDate.divide(BigDecimal.valueOf(daysElapsed), SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 計算月底預估支出。
     */
    public static BigDecimal projectedMonthEnd(Collection<CostRecord> records, Instant now) {
        BigDecimal mtd = monthToDate(records, now);
        return projectedMonthEnd(mtd, now);
    }

    static BigDecimal projectedMonthEnd(BigDecimal monthToDate, Instant now) {
        int daysRemaining = PeriodUtils.daysRemainingInMonth(PeriodUtils.utcDate(now));
        return monthToDate.add(dailyBurnRateMtd(monthToDate, now).multiply(BigDecimal.valueOf(daysRemaining)));
    }

    /**
     * 一次計算全部指標。
     *
     * @param project 專案 ID，僅做標示
     */
    public static SpendOverview overview(Collection<CostRecord> records, Instant now, int windowDays, String project) {
        LocalDate today = PeriodUtils.utcDate(now);
        BigDecimal mtd = monthToDate(records, now);
        return new SpendOverview(
            project,
            PeriodUtils.formatPeriod(today),
            now,
            windowDays,
            mtd,
            burnRate(records, now, windowDays),
            dailyBurnRateMtd(mtd, now),
            projectedMonthEnd(mtd, now),
            PeriodUtils.daysElapsedInMonth(today),
            PeriodUtils.daysRemainingInMonth(today));
    }
}
