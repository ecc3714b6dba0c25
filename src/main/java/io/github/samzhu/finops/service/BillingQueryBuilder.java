package io.github.samzhu.finops.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.finops.client.warehouse.WarehouseClient;
import io.github.samzhu.finops.client.warehouse.WarehouseIdentifiers;
import io.github.samzhu.finops.client.warehouse.WarehouseQuery;
import io.github.samzhu.finops.config.FinopsProperties;

/**
 * 帳單聚合查詢產生器。
 *
 * <p>對原始帳單匯出表產生參數化的聚合 SQL，分組鍵為
 * {@code (service, project, sku, DATE(usage_start_time), currency, usage.unit)}，
 * 依 {@code time_period, project, service, sku} 排序。
 *
 * <p>每次呼叫都會重新探測資料表是否具有 {@code _PARTITIONDATE}，不做快取：
 * <ul>
 *   <li>有分區欄位 - 以 {@code _PARTITIONDATE} 過濾；未指定起日時下界為
 *       {@code finops.warehouse.epoch-start-date}，未指定迄日時上界為今天 (UTC)，確保 partition pruning 生效</li>
 *   <li>無分區欄位 - 以 {@code DATE(usage_start_time)} 過濾；未指定的一端不加條件 (全表掃描，成本較高)</li>
 * </ul>
 *
 * <p>日期值一律以 {@code @start_date} / {@code @end_date} 參數綁定，兩端皆為包含。
 */
@Component
public class BillingQueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(BillingQueryBuilder.class);

    static final String START_PARAM = "start_date";
    static final String END_PARAM = "end_date";

    private final WarehouseClient warehouseClient;
    private final FinopsProperties properties;
    private final Clock clock;

    public BillingQueryBuilder(WarehouseClient warehouseClient, FinopsProperties properties, Clock clock) {
        this.warehouseClient = warehouseClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 探測資料表後產生聚合查詢。
     *
     * @param datasetId 資料集 ID
     * @param tableId 資料表 ID
     * @param startDate 起日 (包含)，可為 null
     * @param endDate 迄日 (包含)，可為 null
     * @return 查詢與所選的過濾欄位
     * @throws io.github.samzhu.finops.exception.ConfigurationException 識別字不合法或資料表無法存取
     * @throws IllegalArgumentException 起日晚於迄日
     */
    public BillingQuery build(String datasetId, String tableId, LocalDate startDate, LocalDate endDate) {
        String table = WarehouseIdentifiers.qualifiedTable(warehouseClient.projectId(), datasetId, tableId);
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new IllegalArgumentException(
                String.format("startDate %s is after endDate %s", startDate, endDate));
        }

        boolean hasPartitionDate = warehouseClient.columnExists(
            datasetId, tableId, FilterColumn.PARTITION_DATE.column());
        FilterColumn filterColumn = FilterColumn.choose(hasPartitionDate);

        if (filterColumn == FilterColumn.EVENT_TIME && (startDate == null || endDate == null)) {
            log.info("Table {}.{} has no partition column and date range is open: start={}, end={}, full scan expected",
                datasetId, tableId, startDate, endDate);
        }

        WarehouseQuery query = buildQuery(table, filterColumn, startDate, endDate,
            properties.warehouse().epochStartDate(), LocalDate.now(clock));
        log.debug("Billing query built: table={}, filterColumn={}, params={}",
            table, filterColumn, query.dateParameters());
        return new BillingQuery(query, filterColumn);
    }

    /**
     * 產生聚合查詢 (不做探測)。
     *
     * @param qualifiedTable 已驗證的完整資料表名稱
     * @param filterColumn 過濾欄位
     * @param startDate 起日，可為 null
     * @param endDate 迄日，可為 null
     * @param epochStart 分區路徑的預設下界
     * @param today 分區路徑的預設上界
     */
    static WarehouseQuery buildQuery(String qualifiedTable, FilterColumn filterColumn,
                                     LocalDate startDate, LocalDate endDate,
                                     LocalDate epochStart, LocalDate today) {
        LocalDate lower = startDate;
        LocalDate upper = endDate;
        if (filterColumn == FilterColumn.PARTITION_DATE) {
            lower = lower != null ? lower : epochStart;
            upper = upper != null ? upper : today;
        }

        Map<String, LocalDate> params = new LinkedHashMap<>();
        StringBuilder where = new StringBuilder();
        if (lower != null) {
            where.append(filterColumn.expression()).append(" >= @").append(START_PARAM);
            params.put(START_PARAM, lower);
        }
        if (upper != null) {
            if (!where.isEmpty()) {
                where.append(" AND ");
            }
            where.append(filterColumn.expression()).append(" <= @").append(END_PARAM);
            params.put(END_PARAM, upper);
        }

        StringBuilder sql = new StringBuilder()
            .append("SELECT\n")
            .append("  service.description AS service,\n")
            .append("  project.id AS project,\n")
            .append("  sku.description AS sku,\n")
            .append("  DATE(usage_start_time) AS time_period,\n")
            .append("  SUM(cost) AS cost,\n")
            .append("  currency AS currency,\n")
            .append("  SUM(usage.amount) AS usage_amount,\n")
            .append("  usage.unit AS usage_unit\n")
            .append("FROM ").append(qualifiedTable).append('\n');
        if (!where.isEmpty()) {
            sql.append("WHERE ").append(where).append('\n');
        }
        sql.append("GROUP BY service, project, sku, time_period, currency, usage_unit\n")
            .append("ORDER BY time_period, project, service, sku");

        return new WarehouseQuery(sql.toString(), params);
    }

    /**
     * 產生的帳單查詢。
     *
     * @param query 參數化查詢
     * @param filterColumn 本次選用的過濾欄位
     */
    public record BillingQuery(WarehouseQuery query, FilterColumn filterColumn) {}
}
