package io.github.samzhu.finops.service;

/**
 * 帳單查詢的日期過濾欄位。
 *
 * <ul>
 *   <li>{@link #PARTITION_DATE} - ingestion-time 分區虛擬欄位 {@code _PARTITIONDATE}，可做 partition pruning</li>
 *   <li>{@link #EVENT_TIME} - 事件時間 {@code usage_start_time} 的日期，未限制範圍時會掃描全表</li>
 * </ul>
 *
 * @see <a href="https://cloud.google.com/bigquery/docs/querying-partitioned-tables">Query partitioned tables</a>
 */
public enum FilterColumn {

    PARTITION_DATE("_PARTITIONDATE", "_PARTITIONDATE"),
    EVENT_TIME("usage_start_time", "DATE(usage_start_time)");

    private final String column;
    private final String expression;

    FilterColumn(String column, String expression) {
        this.column = column;
        this.expression = expression;
    }

    /**
     * 資料表中的欄位名稱，用於欄位存在性探測。
     */
    public String column() {
        return column;
    }

    /**
     * WHERE 子句中使用的 DATE 運算式。
     */
    public String expression() {
        return expression;
    }

    /**
     * 依探測結果選擇過濾欄位。
     *
     * @param hasPartitionDate 資料表是否具有 {@code _PARTITIONDATE}
     */
    public static FilterColumn choose(boolean hasPartitionDate) {
        return hasPartitionDate ? PARTITION_DATE : EVENT_TIME;
    }
}
