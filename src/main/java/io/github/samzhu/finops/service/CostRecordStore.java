package io.github.samzhu.finops.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.bson.types.Decimal128;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.document.CostRecord.NaturalKey;
import io.github.samzhu.finops.dto.CostRecordFilter;
import io.github.samzhu.finops.dto.CostRecordPage;
import io.github.samzhu.finops.repository.CostRecordRepository;

/**
 * 成本紀錄的 upsert 儲存。
 *
 * <p>以自然鍵 {@code (service, project, sku, timePeriod)} 做 insert-or-update：
 * <ul>
 *   <li>自然鍵欄位 - 由 upsert 查詢條件帶入新文件</li>
 *   <li>{@code $setOnInsert} - {@code createdAt}，只在第一次寫入時設定</li>
 *   <li>{@code $set} - cost、currency、usageAmount、usageUnit、updatedAt，每次覆寫</li>
 * </ul>
 *
 * <p>批次寫入在單一 MongoDB 交易中執行，任何錯誤都會讓整批回滾。
 * 同一批次內自然鍵重複時，以批次中最後一筆為準。
 *
 * <p>不同呼叫之間不做鍵層級鎖定，重疊的匯入以最後提交者為準。
 * 儲存層錯誤 ({@link org.springframework.dao.DataAccessException}) 原樣往上拋出。
 *
 * @see <a href="https://www.mongodb.com/docs/manual/reference/method/db.collection.bulkWrite/">bulkWrite</a>
 */
@Service
public class CostRecordStore {

    private static final Logger log = LoggerFactory.getLogger(CostRecordStore.class);

    private static final int REREAD_CHUNK_SIZE = 200;

    private static final Sort DEFAULT_SORT = Sort.by(
        Sort.Order.asc("timePeriod"),
        Sort.Order.asc("project"),
        Sort.Order.asc("service"),
        Sort.Order.asc("sku"));

    private static final Sort LATEST_FIRST_SORT = Sort.by(
        Sort.Order.desc("timePeriod"),
        Sort.Order.desc("project"),
        Sort.Order.desc("service"),
        Sort.Order.desc("sku"));

    private final MongoTemplate mongoTemplate;
    private final CostRecordRepository repository;
    private final Clock clock;

    public CostRecordStore(MongoTemplate mongoTemplate, CostRecordRepository repository, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.repository = repository;
        this.clock = clock;
    }

    // ========== 寫入 ==========

    /**
     * 寫入單筆紀錄。
     *
     * @return 寫入後的紀錄 (含 ID 與時間戳)
     */
    public CostRecord upsert(CostRecord record) {
        Instant now = Instant.now(clock);
        CostRecord saved = mongoTemplate.findAndModify(
            keyQuery(record.naturalKey()),
            upsertUpdate(record, now),
            FindAndModifyOptions.options().upsert(true).returnNew(true),
            CostRecord.class);

        log.debug("Cost record upserted: service={}, project={}, sku={}, timePeriod={}",
            record.service(), record.project(), record.sku(), record.timePeriod());
        return saved;
    }

    /**
     * 在單一交易中批次寫入。
     *
     * @param records 要寫入的紀錄，可包含重複自然鍵
     * @return 寫入後的紀錄，依自然鍵去重，順序為各鍵第一次出現的位置；空輸入回傳空列表
     */
    @Transactional
    public List<CostRecord> bulkUpsert(List<CostRecord> records) {
        if (records.isEmpty()) {
            log.debug("Empty batch, skipping upsert");
            return List.of();
        }

        long startTime = System.currentTimeMillis();

        // 同鍵以最後一筆為準
        Map<NaturalKey, CostRecord> deduped = new LinkedHashMap<>();
        records.forEach(r -> deduped.put(r.naturalKey(), r));

        Instant now = Instant.now(clock);
        BulkOperations bulkOps = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, CostRecord.class);
        deduped.forEach((key, record) -> bulkOps.upsert(keyQuery(key), upsertUpdate(record, now)));
        bulkOps.execute();

        List<CostRecord> persisted = findByKeys(new ArrayList<>(deduped.keySet()));

        log.info("Bulk upsert completed: {} records ({} distinct keys) in {}ms",
            records.size(), deduped.size(), System.currentTimeMillis() - startTime);
        return persisted;
    }

    // ========== 查詢 ==========

    public Optional<CostRecord> findById(String id) {
        return repository.findById(id);
    }

    /**
     * 條件查詢，結果依 timePeriod、project、service、sku 排序。
     *
     * @param filter 查詢條件
     * @param skip 略過筆數
     * @param limit 每頁上限
     * @param includeTotal 是否計算分頁前總筆數
     */
    public CostRecordPage find(CostRecordFilter filter, int skip, int limit, boolean includeTotal) {
        Query query = new Query(toCriteria(filter));
        Long total = includeTotal ? mongoTemplate.count(query, CostRecord.class) : null;

        query.with(DEFAULT_SORT).skip(skip).limit(limit);
        List<CostRecord> records = mongoTemplate.find(query, CostRecord.class);
        return new CostRecordPage(records, total, skip, limit);
    }

    /**
     * 條件查詢，最多回傳 {@code limit} 筆。
     */
    public List<CostRecord> find(CostRecordFilter filter, int limit) {
        return find(filter, 0, limit, false).records();
    }

    /**
     * 取範圍內最新的 {@code limit} 筆紀錄，回傳時改回 timePeriod 由舊到新的順序。
     *
     * @return 含範圍內總筆數的結果，總筆數大於回傳筆數表示較舊的紀錄未載入
     */
    public CostRecordPage findLatest(CostRecordFilter filter, int limit) {
        Query query = new Query(toCriteria(filter));
        long total = mongoTemplate.count(query, CostRecord.class);

        query.with(LATEST_FIRST_SORT).limit(limit);
        List<CostRecord> records = new ArrayList<>(mongoTemplate.find(query, CostRecord.class));
        Collections.reverse(records);
        return new CostRecordPage(records, total, 0, limit);
    }

    /**
     * 查詢某日 (含) 之後的紀錄。
     *
     * @param project 專案 ID，null 表示全部專案
     * @param from 起日
     */
    public List<CostRecord> findSince(String project, LocalDate from) {
        return project == null
            ? repository.findByTimePeriodGreaterThanEqual(from)
            : repository.findByProjectAndTimePeriodGreaterThanEqual(project, from);
    }

    public List<String> distinctServices() {
        return distinct("service");
    }

    public List<String> distinctProjects() {
        return distinct("project");
    }

    public List<String> distinctSkus() {
        return distinct("sku");
    }

    private List<String> distinct(String field) {
        return mongoTemplate.findDistinct(new Query(), field, CostRecord.class, String.class).stream()
            .filter(Objects::nonNull)
            .sorted(Comparator.naturalOrder())
            .toList();
    }

    private List<CostRecord> findByKeys(List<NaturalKey> keys) {
        Map<NaturalKey, CostRecord> byKey = new HashMap<>();
        for (int from = 0; from < keys.size(); from += REREAD_CHUNK_SIZE) {
            List<NaturalKey> chunk = keys.subList(from, Math.min(from + REREAD_CHUNK_SIZE, keys.size()));
            Criteria[] criteria = chunk.stream().map(CostRecordStore::keyCriteria).toArray(Criteria[]::new);
            mongoTemplate.find(new Query(new Criteria().orOperator(criteria)), CostRecord.class)
                .forEach(r -> byKey.put(r.naturalKey(), r));
        }
        return keys.stream().map(byKey::get).filter(Objects::nonNull).toList();
    }

    // ========== Query / Update 組裝 ==========

    private static Query keyQuery(NaturalKey key) {
        return new Query(keyCriteria(key));
    }

    private static Criteria keyCriteria(NaturalKey key) {
        return Criteria.where("service").is(key.service())
            .and("project").is(key.project())
            .and("sku").is(key.sku())
            .and("timePeriod").is(key.timePeriod());
    }

    private static Update upsertUpdate(CostRecord record, Instant now) {
        return new Update()
            .setOnInsert("createdAt", now)
            .set("cost", new Decimal128(record.cost()))
            .set("currency", record.currency())
            .set("usageAmount", record.usageAmount() == null ? null : new Decimal128(record.usageAmount()))
            .set("usageUnit", record.usageUnit())
            .set("updatedAt", now);
    }

    static Criteria toCriteria(CostRecordFilter filter) {
        Criteria criteria = new Criteria();
        if (filter.service() != null) {
            criteria.and("service").is(filter.service());
        }
        if (filter.project() != null) {
            criteria.and("project").is(filter.project());
        }
        if (filter.sku() != null) {
            criteria.and("sku").is(filter.sku());
        }
        if (filter.startDate() != null || filter.endDate() != null) {
            Criteria period = criteria.and("timePeriod");
            if (filter.startDate() != null) {
                period.gte(filter.startDate());
            }
            if (filter.endDate() != null) {
                period.lte(filter.endDate());
            }
        }
        return criteria;
    }
}
