package io.github.samzhu.finops.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import io.github.samzhu.finops.client.llm.GeminiTextBackend;
import io.github.samzhu.finops.client.llm.GenerativeTextBackend;

/**
 * 生成式文字後端配置。
 *
 * <p>以 Spring Boot 自動配置的 {@link RestClient.Builder} 建立 Gemini 專用的 RestClient，
 * 設定 base URL 與讀取逾時 ({@code finops.insight.timeout})。
 *
 * @see <a href="https://docs.spring.io/spring-framework/reference/integration/rest-clients.html#rest-restclient">RestClient</a>
 */
@Configuration
public class GeminiConfig {

    @Bean
    public GenerativeTextBackend generativeTextBackend(RestClient.Builder restClientBuilder,
                                                       FinopsProperties properties) {
        FinopsProperties.InsightConfig insight = properties.insight();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(10_000);
        requestFactory.setReadTimeout((int) insight.timeout().toMillis());

        RestClient restClient = restClientBuilder
            .baseUrl(insight.baseUrl())
            .requestFactory(requestFactory)
            .build();
        return new GeminiTextBackend(restClient, insight.model(), insight.apiKey());
    }
}
