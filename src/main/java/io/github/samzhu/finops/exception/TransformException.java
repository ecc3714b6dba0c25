package io.github.samzhu.finops.exception;

import java.util.Map;

/**
 * 倉儲資料列無法轉換為成本紀錄時拋出。
 *
 * <p>處理方式：
 * <ul>
 *   <li>整批匯入中止，不會寫入任何紀錄</li>
 *   <li>例外攜帶出錯的原始資料列與其在批次中的位置，方便追查</li>
 * </ul>
 */
public class TransformException extends FinopsException {

    private final transient Map<String, Object> row;
    private final int rowIndex;

    public TransformException(String reason, Map<String, Object> row, int rowIndex) {
        super(String.format("Malformed warehouse row at index %d: %s, row=%s", rowIndex, reason, row));
        this.row = row;
        this.rowIndex = rowIndex;
    }

    public TransformException(String reason, Map<String, Object> row, int rowIndex, Throwable cause) {
        super(String.format("Malformed warehouse row at index %d: %s, row=%s", rowIndex, reason, row), cause);
        this.row = row;
        this.rowIndex = rowIndex;
    }

    public Map<String, Object> getRow() {
        return row;
    }

    public int getRowIndex() {
        return rowIndex;
    }
}
