package io.github.samzhu.finops.client.warehouse;

import java.util.regex.Pattern;

import io.github.samzhu.finops.exception.ConfigurationException;

/**
 * BigQuery 識別字驗證工具類。
 *
 * <p>資料表名稱無法以查詢參數綁定，組裝 SQL 前必須先通過這裡的格式檢查，
 * 不合法的識別字在呼叫倉儲之前就以 {@link ConfigurationException} 拒絕。
 *
 * @see <a href="https://cloud.google.com/bigquery/docs/datasets#dataset-naming">Dataset naming</a>
 * @see <a href="https://cloud.google.com/bigquery/docs/tables#table_naming">Table naming</a>
 */
public final class WarehouseIdentifiers {

    private static final Pattern PROJECT = Pattern.compile("[A-Za-z0-9.:_\\-]{1,128}");
    private static final Pattern DATASET = Pattern.compile("[A-Za-z0-9_]{1,1024}");
    private static final Pattern TABLE = Pattern.compile("[A-Za-z0-9_\\-$*]{1,1024}");

    private WarehouseIdentifiers() {
        // 工具類不允許實例化
    }

    public static String requireDataset(String datasetId) {
        if (datasetId == null || !DATASET.matcher(datasetId).matches()) {
            throw new ConfigurationException(
                String.format("Invalid dataset id: '%s'", datasetId), datasetId, null);
        }
        return datasetId;
    }

    public static String requireTable(String datasetId, String tableId) {
        requireDataset(datasetId);
        if (tableId == null || !TABLE.matcher(tableId).matches()) {
            throw new ConfigurationException(
                String.format("Invalid table id: '%s'", tableId), datasetId, tableId);
        }
        return tableId;
    }

    /**
     * 組成完整資料表名稱，例如 {@code `my-project.billing.gcp_billing_export_v1`}。
     */
    public static String qualifiedTable(String projectId, String datasetId, String tableId) {
        requireTable(datasetId, tableId);
        if (projectId == null || !PROJECT.matcher(projectId).matches()) {
            throw new ConfigurationException(
                String.format("Invalid project id: '%s'", projectId), datasetId, tableId);
        }
        return "`" + projectId + "." + datasetId + "." + tableId + "`";
    }
}
