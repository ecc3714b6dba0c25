package io.github.samzhu.finops.repository;

import java.time.LocalDate;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.finops.document.CostRecord;

/**
 * 成本紀錄資料存取介面。
 *
 * <p>提供對 {@code cost_records} 集合的查詢。寫入一律透過
 * {@link io.github.samzhu.finops.service.CostRecordStore} 以自然鍵 upsert 完成，
 * 不應使用 {@code save()} 以免產生重複紀錄。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/query-methods.html">Query Methods</a>
 */
public interface CostRecordRepository extends MongoRepository<CostRecord, String> {

    /**
     * 查詢某日 (含) 之後的所有紀錄，供指標計算使用。
     */
    List<CostRecord> findByTimePeriodGreaterThanEqual(LocalDate from);

    /**
     * 查詢特定專案在某日 (含) 之後的所有紀錄。
     */
    List<CostRecord> findByProjectAndTimePeriodGreaterThanEqual(String project, LocalDate from);
}
