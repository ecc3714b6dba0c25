package io.github.samzhu.finops.client.warehouse;

import java.util.List;

/**
 * 資料集列表的一頁。
 *
 * @param projectId 所屬專案
 * @param datasetIds 本頁的資料集 ID
 * @param nextPageToken 下一頁 token，沒有下一頁時為 null
 */
public record DatasetPage(
    String projectId,
    List<String> datasetIds,
    String nextPageToken
) {}
