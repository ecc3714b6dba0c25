package io.github.samzhu.finops.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.finops.dto.IngestionRequest;
import io.github.samzhu.finops.dto.IngestionResult;
import io.github.samzhu.finops.service.BillingIngestionService;

/**
 * 帳單匯出完成事件的消費者函式配置。
 *
 * <p>使用 Spring Cloud Function 程式設計模型，消費來自 Pub/Sub 的 CloudEvents。
 * 事件以 <b>Structured Mode</b> ({@code application/cloudevents+json}) 送達，
 * data 欄位即為 {@link IngestionRequest}。
 *
 * <p>收到事件後同步執行一次帳單匯入。匯入是全有或全無，
 * 同一事件重複送達只會以相同資料覆寫相同的自然鍵。
 *
 * <p>Binding name: {@code billingExportConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class BillingExportFunction {

    private static final Logger log = LoggerFactory.getLogger(BillingExportFunction.class);

    private final BillingIngestionService ingestionService;

    public BillingExportFunction(BillingIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    /**
     * 帳單匯出事件消費者 Bean。
     *
     * <p>錯誤處理：記錄 ERROR 後不重新拋出例外，避免訊息重複投遞迴圈。
     * 失敗的匯入不會留下部分資料，可由下一個事件或 REST API 重跑。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<IngestionRequest>> billingExportConsumer() {
        return message -> {
            try {
                IngestionRequest request = message.getPayload();

                log.debug("CloudEvent received: id={}, type={}, source={}, dataset={}, table={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    CloudEventMessageUtils.getSource(message),
                    request.datasetId(), request.tableId());

                IngestionResult result = ingestionService.ingest(request);

                log.info("Billing export event processed: id={}, persisted={}",
                    CloudEventMessageUtils.getId(message), result.recordsPersisted());
            } catch (Exception e) {
                log.error("Failed to process billing export event: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
                // 不重新拋出例外，避免訊息重複投遞
            }
        };
    }
}
