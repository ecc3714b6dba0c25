package io.github.samzhu.finops.config;

import java.time.Duration;
import java.time.LocalDate;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * FinOps 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link WarehouseConfig} - BigQuery 帳單表查詢設定</li>
 *   <li>{@link InsightConfig} - Gemini 洞察產生設定 (模型、取樣參數、prompt 長度上限)</li>
 *   <li>{@link MetricsConfig} - 支出指標設定</li>
 *   <li>{@link ExecutorConfig} - 阻塞工作使用的執行緒池大小</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * finops:
 *   warehouse:
 *     epoch-start-date: 1970-01-01
 *     query-timeout: 120s
 *   insight:
 *     model: gemini-2.5-flash
 *     api-key: ${GOOGLE_API_KEY:}
 *     max-input-chars: 8000
 *   metrics:
 *     burn-rate-window-days: 30
 *   executor:
 *     warehouse-pool-size: 4
 *     insight-pool-size: 8
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "finops")
public record FinopsProperties(
    WarehouseConfig warehouse,
    InsightConfig insight,
    MetricsConfig metrics,
    ExecutorConfig executor
) {
    public FinopsProperties {
        if (warehouse == null) {
            warehouse = WarehouseConfig.defaults();
        }
        if (insight == null) {
            insight = InsightConfig.defaults();
        }
        if (metrics == null) {
            metrics = MetricsConfig.defaults();
        }
        if (executor == null) {
            executor = ExecutorConfig.defaults();
        }
    }

    /**
     * 建立全預設值的配置，主要供測試使用。
     */
    public static FinopsProperties defaults() {
        return new FinopsProperties(null, null, null, null);
    }

    /**
     * BigQuery 帳單表查詢設定。
     *
     * <p>過濾欄位的選擇見 {@link io.github.samzhu.finops.service.FilterColumn}。
     *
     * @param projectId BigQuery 專案 ID，空白時使用 {@code spring.cloud.gcp.project-id}
     * @param epochStartDate 分區路徑未指定起日時使用的下界，預設 1970-01-01
     * @param queryTimeout 查詢逾時，預設 120 秒
     */
    public record WarehouseConfig(
        String projectId,
        LocalDate epochStartDate,
        Duration queryTimeout
    ) {
        public WarehouseConfig {
            if (epochStartDate == null) {
                epochStartDate = LocalDate.of(1970, 1, 1);
            }
            if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
                queryTimeout = Duration.ofSeconds(120);
            }
        }

        /**
         * 建立預設倉儲設定。
         */
        public static WarehouseConfig defaults() {
            return new WarehouseConfig(null, null, null);
        }
    }

    /**
     * Gemini 洞察產生設定。
     *
     * <p>取樣參數固定，不隨請求變動：temperature 0.2、topP 0.8、topK 40、
     * maxOutputTokens 1024。
     *
     * @param baseUrl Generative Language API 基底 URL
     * @param model 模型名稱，預設 {@code gemini-2.5-flash}
     * @param apiKey API key，以 {@code key} query 參數傳送
     * @param maxInputChars 序列化紀錄的字元上限，預設 8000
     * @param maxRecords 單次洞察最多載入的成本紀錄數，預設 500
     * @param temperature 取樣溫度
     * @param topP nucleus sampling 機率
     * @param topK top-k 取樣數
     * @param maxOutputTokens 最大輸出 token 數
     * @param timeout HTTP 讀取逾時，預設 60 秒
     */
    public record InsightConfig(
        String baseUrl,
        String model,
        String apiKey,
        int maxInputChars,
        int maxRecords,
        Double temperature,
        Double topP,
        Integer topK,
        Integer maxOutputTokens,
        Duration timeout
    ) {
        public InsightConfig {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "https://generativelanguage.googleapis.com/v1beta";
            }
            if (model == null || model.isBlank()) {
                model = "gemini-2.5-flash";
            }
            if (apiKey == null) {
                apiKey = "";
            }
            if (maxInputChars <= 0) {
                maxInputChars = 8000;
            }
            if (maxRecords <= 0) {
                maxRecords = 500;
            }
            if (temperature == null) {
                temperature = 0.2;
            }
            if (topP == null) {
                topP = 0.8;
            }
            if (topK == null) {
                topK = 40;
            }
            if (maxOutputTokens == null) {
                maxOutputTokens = 1024;
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                timeout = Duration.ofSeconds(60);
            }
        }

        /**
         * 建立預設洞察設定。
         */
        public static InsightConfig defaults() {
            return new InsightConfig(null, null, null, 0, 0, null, null, null, null, null);
        }
    }

    /**
     * 支出指標設定。
     *
     * @param burnRateWindowDays 燃燒率回溯天數，預設 30
     */
    public record MetricsConfig(
        int burnRateWindowDays
    ) {
        public MetricsConfig {
            if (burnRateWindowDays <= 0) {
                burnRateWindowDays = 30;
            }
        }

        public static MetricsConfig defaults() {
            return new MetricsConfig(30);
        }
    }

    /**
     * 執行緒池設定。
     *
     * @param warehousePoolSize BigQuery 匯入與瀏覽用執行緒數，預設 4
     * @param insightPoolSize Gemini 呼叫用執行緒數，預設 8
     */
    public record ExecutorConfig(
        int warehousePoolSize,
        int insightPoolSize
    ) {
        public ExecutorConfig {
            if (warehousePoolSize <= 0) {
                warehousePoolSize = 4;
            }
            if (insightPoolSize <= 0) {
                insightPoolSize = 8;
            }
        }

        public static ExecutorConfig defaults() {
            return new ExecutorConfig(4, 8);
        }
    }
}
