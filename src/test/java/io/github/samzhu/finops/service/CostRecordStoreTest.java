package io.github.samzhu.finops.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import io.github.samzhu.finops.config.MongoConfig;
import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.dto.CostRecordFilter;
import io.github.samzhu.finops.dto.CostRecordPage;

/**
 * CostRecordStore 整合測試，MongoDB 以單節點 replica set 容器執行 (交易需要)。
 */
@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
@Import({CostRecordStore.class, MongoConfig.class, CostRecordStoreTest.ClockConfig.class})
class CostRecordStoreTest {

    @Container
    @ServiceConnection
    static MongoDBContainer mongo = new MongoDBContainer("mongo:7.0");

    @Autowired
    private CostRecordStore store;

    @Autowired
    private MongoTemplate mongoTemplate;

    @Autowired
    private SteppingClock clock;

    @BeforeEach
    void cleanUp() {
        if (!mongoTemplate.collectionExists(CostRecord.class)) {
            mongoTemplate.createCollection(CostRecord.class);
        }
        setValidator(new Document());
        mongoTemplate.remove(new Query(), CostRecord.class);
        clock.reset();
    }

    @Test
    void shouldBeIdempotentAndKeepCreatedAt() {
        // Given
        CostRecord first = record("Compute Engine", "N1 Core", 15, "10.00");
        CostRecord inserted = store.upsert(first);

        // When: 一小時後以相同內容再寫入
        clock.advance(Duration.ofHours(1));
        CostRecord again = store.upsert(first);

        // Then
        assertThat(mongoTemplate.count(new Query(), CostRecord.class)).isEqualTo(1);
        assertThat(again.id()).isEqualTo(inserted.id());
        assertThat(again.createdAt()).isEqualTo(inserted.createdAt());
        assertThat(again.updatedAt()).isAfter(inserted.updatedAt());
        assertThat(again.cost()).isEqualByComparingTo("10.00");
    }

    @Test
    void shouldOverwriteValuesOnKeyCollision() {
        store.bulkUpsert(List.of(record("Compute Engine", "N1 Core", 15, "10.00")));

        List<CostRecord> result = store.bulkUpsert(List.of(record("Compute Engine", "N1 Core", 15, "15.00")));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).cost()).isEqualByComparingTo("15.00");
        assertThat(store.find(CostRecordFilter.none(), 10)).hasSize(1);
    }

    @Test
    void shouldReturnOverwrittenTotalForProjectAndMonth() {
        // Given: 同一鍵先 10.00 再 15.00，另有其他專案與其他月份的紀錄
        store.bulkUpsert(List.of(
            record("Compute Engine", "N1 Core", 15, "10.00"),
            CostRecord.of("Compute Engine", "proj-b", "N1 Core", LocalDate.of(2025, 1, 15),
                new BigDecimal("7.00"), "USD", null, null),
            CostRecord.of("Compute Engine", "proj-a", "N1 Core", LocalDate.of(2025, 2, 1),
                new BigDecimal("3.00"), "USD", null, null)));
        store.bulkUpsert(List.of(record("Compute Engine", "N1 Core", 15, "15.00")));

        // When
        CostRecordPage page = store.find(new CostRecordFilter(null, "proj-a", null,
            LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)), 0, 100, true);

        // Then
        assertThat(page.total()).isEqualTo(1L);
        BigDecimal total = page.records().stream().map(CostRecord::cost).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(total).isEqualByComparingTo("15.00");
    }

    @Test
    void shouldRollBackWholeBatchWhenWriteFails() {
        // Given: 既有一筆紀錄，集合驗證規則拒絕負數成本
        store.upsert(record("Compute Engine", "sku-0", 15, "10.00"));
        requireNonNegativeCost();

        List<CostRecord> batch = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            batch.add(record("Compute Engine", "sku-" + i, 15, i == 4 ? "-1.00" : "1.00"));
        }

        // When
        assertThatThrownBy(() -> store.bulkUpsert(batch)).isInstanceOf(DataAccessException.class);

        // Then: 其餘 9 筆都沒有寫入，既有紀錄維持原值
        assertThat(mongoTemplate.count(new Query(), CostRecord.class)).isEqualTo(1);
        assertThat(store.find(CostRecordFilter.none(), 10).get(0).cost()).isEqualByComparingTo("10.00");
    }

    @Test
    void shouldLoadMostRecentRecordsInChronologicalOrder() {
        // Given
        for (int day = 1; day <= 5; day++) {
            store.upsert(record("Compute Engine", "N1 Core", day, "1.00"));
        }

        // When
        CostRecordPage page = store.findLatest(CostRecordFilter.forProject("proj-a"), 2);

        // Then
        assertThat(page.total()).isEqualTo(5L);
        assertThat(page.records()).extracting(CostRecord::timePeriod)
            .containsExactly(LocalDate.of(2025, 1, 4), LocalDate.of(2025, 1, 5));
    }

    @Test
    void shouldApplyLastDuplicateInBatch() {
        // Given
        List<CostRecord> batch = List.of(
            record("Compute Engine", "N1 Core", 15, "1.00"),
            record("BigQuery", "Analysis", 15, "2.00"),
            record("Compute Engine", "N1 Core", 15, "3.00"));

        // When
        List<CostRecord> result = store.bulkUpsert(batch);

        // Then: 依鍵第一次出現的順序，值為最後一筆
        assertThat(result).extracting(CostRecord::service).containsExactly("Compute Engine", "BigQuery");
        assertThat(result.get(0).cost()).isEqualByComparingTo("3.00");
        assertThat(result.get(0).usageAmount()).isEqualByComparingTo("24");
    }

    @Test
    void shouldReturnEmptyForEmptyBatch() {
        assertThat(store.bulkUpsert(List.of())).isEmpty();
    }

    @Test
    void shouldCountTotalBeforePagination() {
        // Given
        for (int day = 1; day <= 5; day++) {
            store.upsert(record("Compute Engine", "N1 Core", day, "1.00"));
        }
        store.upsert(CostRecord.of("Compute Engine", "proj-b", "N1 Core", LocalDate.of(2025, 1, 1),
            new BigDecimal("9"), "USD", null, null));

        // When
        CostRecordPage page = store.find(CostRecordFilter.forProject("proj-a"), 1, 2, true);

        // Then
        assertThat(page.total()).isEqualTo(5L);
        assertThat(page.records()).extracting(CostRecord::timePeriod)
            .containsExactly(LocalDate.of(2025, 1, 2), LocalDate.of(2025, 1, 3));
    }

    @Test
    void shouldFilterByDateRange() {
        for (int day = 1; day <= 5; day++) {
            store.upsert(record("Compute Engine", "N1 Core", day, "1.00"));
        }

        List<CostRecord> records = store.find(new CostRecordFilter(null, null, null,
            LocalDate.of(2025, 1, 2), LocalDate.of(2025, 1, 4)), 100);

        assertThat(records).hasSize(3);
        assertThat(store.findSince("proj-a", LocalDate.of(2025, 1, 4))).hasSize(2);
    }

    @Test
    void shouldListDistinctValuesSorted() {
        store.bulkUpsert(List.of(
            record("Compute Engine", "N1 Core", 1, "1.00"),
            record("BigQuery", "Analysis", 1, "1.00"),
            record("BigQuery", "Streaming Insert", 2, "1.00")));

        assertThat(store.distinctServices()).containsExactly("BigQuery", "Compute Engine");
        assertThat(store.distinctSkus()).containsExactly("Analysis", "N1 Core", "Streaming Insert");
        assertThat(store.distinctProjects()).containsExactly("proj-a");
    }

    private void requireNonNegativeCost() {
        setValidator(new Document("cost", new Document("$gte", 0)));
    }

    private void setValidator(Document validator) {
        mongoTemplate.getDb().runCommand(new Document("collMod", mongoTemplate.getCollectionName(CostRecord.class))
            .append("validator", validator));
    }

    private static CostRecord record(String service, String sku, int day, String cost) {
        return CostRecord.of(service, "proj-a", sku, LocalDate.of(2025, 1, day),
            new BigDecimal(cost), "USD", new BigDecimal("24"), "hour");
    }

    @TestConfiguration
    static class ClockConfig {

        @Bean
        SteppingClock clock() {
            return new SteppingClock();
        }
    }

    /**
     * 可手動前進的測試時鐘。
     */
    static class SteppingClock extends Clock {

        private static final Instant START = Instant.parse("2025-01-20T08:00:00Z");

        private Instant now = START;

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        void reset() {
            now = START;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
