package io.github.samzhu.finops.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.finops.document.InsightRecord;

/**
 * 洞察紀錄資料存取介面。
 *
 * <p>洞察建立後不可修改，僅使用 {@code insert} 與查詢方法。
 * 條件查詢見 {@link io.github.samzhu.finops.service.InsightService}。
 */
public interface InsightRecordRepository extends MongoRepository<InsightRecord, String> {
}
