package io.github.samzhu.finops.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>帳單匯出完成通知以 <b>Structured Mode</b> ({@code application/cloudevents+json}) 送達，
 * 此轉換器讓 Spring Cloud Stream 將其拆成：
 * <ul>
 *   <li>CloudEvent attributes (id, type, source, time) → Message Headers</li>
 *   <li>CloudEvent data → Message Payload ({@link io.github.samzhu.finops.dto.IngestionRequest})</li>
 * </ul>
 *
 * <p>需要 {@code cloudevents-json-jackson}，透過 ServiceLoader 提供 JSON 格式支援。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
