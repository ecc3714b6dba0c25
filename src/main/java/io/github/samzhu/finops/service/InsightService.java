package io.github.samzhu.finops.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.document.InsightRecord;
import io.github.samzhu.finops.dto.CostRecordPage;
import io.github.samzhu.finops.dto.InsightFilter;
import io.github.samzhu.finops.dto.InsightPrompt;
import io.github.samzhu.finops.dto.InsightScope;
import io.github.samzhu.finops.dto.api.InsightCreateRequest;
import io.github.samzhu.finops.dto.api.InsightRequest;
import io.github.samzhu.finops.repository.InsightRecordRepository;

/**
 * 洞察服務。
 *
 * <p>產生流程：
 * <ol>
 *   <li>依範圍載入最新的成本紀錄 (最多 {@code finops.insight.max-records} 筆)，超過上限時記錄 WARN 並在 prompt 註明</li>
 *   <li>{@link InsightPromptBuilder} 組裝 prompt</li>
 *   <li>{@link InsightClient} 在 {@code insightExecutor} 上呼叫生成後端</li>
 *   <li>寫入一筆 {@link InsightRecord}</li>
 * </ol>
 *
 * <p>範圍內沒有資料時仍呼叫後端，prompt 為 "No data available ..." 說明
 * ({@code natural_query} 則保留完整 prompt)。
 */
@Service
public class InsightService {

    private static final Logger log = LoggerFactory.getLogger(InsightService.class);

    private final CostRecordStore costRecordStore;
    private final InsightRecordRepository insightRepository;
    private final MongoTemplate mongoTemplate;
    private final InsightPromptBuilder promptBuilder;
    private final InsightClient insightClient;
    private final FinopsProperties properties;
    private final Clock clock;

    public InsightService(
            CostRecordStore costRecordStore,
            InsightRecordRepository insightRepository,
            MongoTemplate mongoTemplate,
            InsightPromptBuilder promptBuilder,
            InsightClient insightClient,
            FinopsProperties properties,
            Clock clock) {
        this.costRecordStore = costRecordStore;
        this.insightRepository = insightRepository;
        this.mongoTemplate = mongoTemplate;
        this.promptBuilder = promptBuilder;
        this.insightClient = insightClient;
        this.properties = properties;
        this.clock = clock;
    }

    // ========== 洞察產生 ==========

    /**
     * 產生並儲存洞察。
     *
     * @throws IllegalArgumentException {@code natural_query} 未提供查詢文字
     */
    public CompletableFuture<InsightRecord> generate(InsightRequest request) {
        String type = InsightInstructions.normalize(request.insightType());
        if (InsightInstructions.NATURAL_QUERY.equals(type)
                && (request.query() == null || request.query().isBlank())) {
            throw new IllegalArgumentException("query is required for insight type natural_query");
        }

        InsightScope scope = request.scope();
        CostRecordPage page = costRecordStore.findLatest(scope.toFilter(), properties.insight().maxRecords());
        List<CostRecord> records = page.records();
        long matching = page.total() != null ? page.total() : records.size();
        if (matching > records.size()) {
            log.warn("Insight scope exceeds record cap, using most recent records: type={}, scope={}, loaded={}, matching={}",
                type, scope, records.size(), matching);
        }

        InsightPrompt prompt = promptBuilder.build(type, request.query(), scope, records, matching);
        log.info("Insight requested: type={}, scope={}, records={}, dataAvailable={}",
            type, scope, records.size(), prompt.dataAvailable());

        return insightClient.generateAsync(prompt).thenApply(text -> save(type, text));
    }

    /**
     * 產生指定期間的支出摘要。
     */
    public CompletableFuture<InsightRecord> generateSpendSummary(String project, LocalDate startDate, LocalDate endDate) {
        return generate(new InsightRequest(null, InsightInstructions.SPEND_SUMMARY,
            project, null, null, startDate, endDate));
    }

    private InsightRecord save(String type, String text) {
        InsightRecord saved = insightRepository.insert(
            InsightRecord.create(type, text, null, null, Instant.now(clock)));
        log.debug("Insight saved: id={}, type={}, chars={}", saved.id(), type, text.length());
        return saved;
    }

    // ========== 手動提交與查詢 ==========

    /**
     * 手動提交洞察。
     */
    public InsightRecord create(InsightCreateRequest request) {
        Instant now = Instant.now(clock);
        InsightRecord record = new InsightRecord(null, request.insightType(), request.insightText(),
            request.relatedCostRecordId(), request.sentiment(),
            request.timestamp() != null ? request.timestamp() : now, now, now);
        InsightRecord saved = insightRepository.insert(record);
        log.info("Insight created: id={}, type={}", saved.id(), saved.insightType());
        return saved;
    }

    public Optional<InsightRecord> findById(String id) {
        return insightRepository.findById(id);
    }

    /**
     * 條件查詢，依洞察時間新到舊排序。
     */
    public List<InsightRecord> find(InsightFilter filter, int skip, int limit) {
        Criteria criteria = new Criteria();
        if (filter.insightType() != null) {
            criteria.and("insightType").is(filter.insightType());
        }
        if (filter.relatedCostRecordId() != null) {
            criteria.and("relatedCostRecordId").is(filter.relatedCostRecordId());
        }
        if (filter.startTime() != null || filter.endTime() != null) {
            Criteria timestamp = criteria.and("timestamp");
            if (filter.startTime() != null) {
                timestamp.gte(filter.startTime());
            }
            if (filter.endTime() != null) {
                timestamp.lte(filter.endTime());
            }
        }

        Query query = new Query(criteria)
            .with(Sort.by(Sort.Direction.DESC, "timestamp"))
            .skip(skip)
            .limit(limit);
        return mongoTemplate.find(query, InsightRecord.class);
    }
}
