package io.github.samzhu.finops.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;

/**
 * 帳單匯入請求。
 *
 * <p>同時作為 REST 請求與 CloudEvent data payload 使用。
 *
 * @param datasetId 帳單匯出資料集 ID
 * @param tableId 帳單匯出資料表 ID
 * @param startDate 起日 (包含)，可為 null
 * @param endDate 迄日 (包含)，可為 null
 */
public record IngestionRequest(
    @NotBlank String datasetId,
    @NotBlank String tableId,
    LocalDate startDate,
    LocalDate endDate
) {}
