package io.github.samzhu.finops;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FinOps Ledger Service - 雲端帳單聚合與支出洞察服務。
 *
 * <p>此服務負責：
 * <ul>
 *   <li>從 BigQuery 帳單匯出表聚合每日成本 (service / project / SKU / 日期)</li>
 *   <li>以自然鍵 upsert 寫入 MongoDB，重複匯入不會產生重複資料</li>
 *   <li>計算月累計支出、燃燒率與月底預估支出</li>
 *   <li>組裝有界長度的 prompt，呼叫 Gemini 產生自然語言洞察</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * BigQuery billing export → Ingestion → MongoDB (cost_records)
 *                                          ↓
 *                               Metrics / Insight → Gemini
 *                                          ↓
 *                                   insight_records
 * </pre>
 *
 * @see <a href="https://cloud.google.com/billing/docs/how-to/export-data-bigquery">Cloud Billing export to BigQuery</a>
 */
@SpringBootApplication
public class FinopsApplication {

    private static final Logger log = LoggerFactory.getLogger(FinopsApplication.class);

    public static void main(String[] args) {
        log.info("Starting FinOps Ledger Service - Cloud Spend Analytics");
        SpringApplication.run(FinopsApplication.class, args);
    }
}
