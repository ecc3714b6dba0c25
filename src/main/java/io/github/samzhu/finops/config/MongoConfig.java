package io.github.samzhu.finops.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用以下功能：
 * <ul>
 *   <li>Repository 自動掃描 - 自動註冊 {@code io.github.samzhu.finops.repository} 下的介面</li>
 *   <li>交易管理 - 批次 upsert 需要全部成功或全部失敗，MongoDB 必須以 replica set 執行</li>
 * </ul>
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code cost_records} - 每日成本聚合，自然鍵 (service, project, sku, timePeriod) 唯一</li>
 *   <li>{@code insight_records} - 產生或手動提交的洞察</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/client-session-transactions.html">Sessions and Transactions</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.finops.repository")
@EnableTransactionManagement
public class MongoConfig {

    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }
}
