package io.github.samzhu.finops.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * 月份週期工具類。
 *
 * <p>提供月累計與月底預估所需的日期計算。
 * 所有時間計算均使用 UTC 時區。
 */
public final class PeriodUtils {

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 取得時間點所在的 UTC 日期。
     */
    public static LocalDate utcDate(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    /**
     * 取得當月 1 號。
     *
     * @param date 任一日期
     * @return 該月 1 號
     */
    public static LocalDate monthStart(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    /**
     * 取得日期的 00:00:00 UTC。
     */
    public static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * 計算當月已經過的天數，包含當天。
     *
     * @param today 當天日期
     * @return 1 號為 1，至少為 1
     */
    public static int daysElapsedInMonth(LocalDate today) {
        return Math.max(1, today.getDayOfMonth());
    }

    /**
     * 計算距離月底的剩餘天數，不含當天。
     *
     * @param today 當天日期
     * @return 月底最後一天為 0
     */
    public static int daysRemainingInMonth(LocalDate today) {
        return today.lengthOfMonth() - today.getDayOfMonth();
    }

    /**
     * 取得週期的格式化字串。
     *
     * @param date 任一日期
     * @return 格式如 "2025-12"
     */
    public static String formatPeriod(LocalDate date) {
        return String.format("%d-%02d", date.getYear(), date.getMonthValue());
    }
}
