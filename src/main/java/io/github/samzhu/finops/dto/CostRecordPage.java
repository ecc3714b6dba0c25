package io.github.samzhu.finops.dto;

import java.util.List;

import io.github.samzhu.finops.document.CostRecord;

/**
 * 成本紀錄分頁結果。
 *
 * @param records 本頁紀錄
 * @param total 分頁前的總筆數，未要求計算時為 null
 * @param skip 略過筆數
 * @param limit 每頁上限
 */
public record CostRecordPage(
    List<CostRecord> records,
    Long total,
    int skip,
    int limit
) {}
