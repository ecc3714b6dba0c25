package io.github.samzhu.finops.exception;

/**
 * 倉儲查詢失敗 (逾時、5xx、網路錯誤) 時拋出。
 *
 * <p>與 {@link ConfigurationException} 不同，此類錯誤可能在稍後重試成功。
 */
public class WarehouseException extends FinopsException {

    private final String operation;

    public WarehouseException(String operation, String message, Throwable cause) {
        super(String.format("Warehouse %s failed: %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
