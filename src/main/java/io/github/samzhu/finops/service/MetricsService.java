package io.github.samzhu.finops.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.dto.SpendOverview;
import io.github.samzhu.finops.util.PeriodUtils;

/**
 * 支出指標服務。
 *
 * <p>從儲存層載入計算所需的紀錄 (當月 1 號與回溯視窗起點兩者較早者之後)，
 * 再交由 {@link SpendMetrics} 計算。「現在」由注入的 {@link Clock} 提供。
 */
@Service
public class MetricsService {

    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    private final CostRecordStore store;
    private final FinopsProperties properties;
    private final Clock clock;

    public MetricsService(CostRecordStore store, FinopsProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 計算支出概況。
     *
     * @param project 專案 ID，null 表示全部專案
     * @param windowDays 燃燒率回溯天數，null 時使用 {@code finops.metrics.burn-rate-window-days}
     */
    public SpendOverview overview(String project, Integer windowDays) {
        int window = windowDays != null ? windowDays : properties.metrics().burnRateWindowDays();
        if (window < 1) {
            throw new IllegalArgumentException("windowDays must be >= 1, got " + window);
        }

        Instant now = Instant.now(clock);
        List<CostRecord> records = store.findSince(project, loadFrom(now, window));
        SpendOverview overview = SpendMetrics.overview(records, now, window, project);

        log.debug("Spend overview computed: project={}, records={}, mtd={}, burnRate={}",
            project, records.size(), overview.mtdSpend(), overview.burnRateEstimatedMonthly());
        return overview;
    }

    static LocalDate loadFrom(Instant now, int windowDays) {
        LocalDate today = PeriodUtils.utcDate(now);
        LocalDate monthStart = PeriodUtils.monthStart(today);
        LocalDate windowStart = today.minusDays(windowDays);
        return windowStart.isBefore(monthStart) ? windowStart : monthStart;
    }
}
