package io.github.samzhu.finops.exception;

/**
 * 倉儲識別字錯誤或無權限存取時拋出。
 *
 * <p>包含格式不合法的 dataset / table ID，以及 BigQuery 回應 400/403/404 的情況。
 * 此類錯誤重試無效，需修正請求或權限設定。
 */
public class ConfigurationException extends FinopsException {

    private final String datasetId;
    private final String tableId;

    public ConfigurationException(String message, String datasetId, String tableId) {
        super(message);
        this.datasetId = datasetId;
        this.tableId = tableId;
    }

    public ConfigurationException(String message, String datasetId, String tableId, Throwable cause) {
        super(message, cause);
        this.datasetId = datasetId;
        this.tableId = tableId;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public String getTableId() {
        return tableId;
    }
}
