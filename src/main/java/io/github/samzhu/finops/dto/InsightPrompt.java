package io.github.samzhu.finops.dto;

/**
 * 組裝完成的 prompt。
 *
 * @param text 送往生成後端的完整文字
 * @param insightType 正規化後的洞察類型
 * @param recordCount 輸入紀錄數
 * @param matchingRecords 範圍內符合條件的總筆數，大於 {@code recordCount} 表示載入時已截取最新的部分
 * @param includedRecords 實際放入 prompt 的紀錄數
 * @param truncated 是否因長度上限截斷
 * @param dataAvailable 是否有任何紀錄
 */
public record InsightPrompt(
    String text,
    String insightType,
    int recordCount,
    long matchingRecords,
    int includedRecords,
    boolean truncated,
    boolean dataAvailable
) {}
