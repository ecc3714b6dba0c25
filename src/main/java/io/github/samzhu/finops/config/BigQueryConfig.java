package io.github.samzhu.finops.config;

import java.io.IOException;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.google.api.gax.core.CredentialsProvider;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.spring.core.GcpProjectIdProvider;

import io.github.samzhu.finops.client.warehouse.BigQueryWarehouseClient;
import io.github.samzhu.finops.client.warehouse.WarehouseClient;

/**
 * BigQuery 倉儲用戶端配置。
 *
 * <p>專案 ID 與憑證沿用 Spring Cloud GCP 的 {@link GcpProjectIdProvider} 與
 * {@link CredentialsProvider} (即 {@code spring.cloud.gcp.*} 設定或 Application Default Credentials)。
 * 若設定了 {@code finops.warehouse.project-id}，則以其為準。
 *
 * @see <a href="https://googleapis.dev/java/spring-cloud-gcp/reference/html/index.html#spring-cloud-gcp-core">Spring Cloud GCP Core</a>
 */
@Configuration
public class BigQueryConfig {

    @Bean
    public BigQuery bigQuery(FinopsProperties properties,
                             GcpProjectIdProvider projectIdProvider,
                             CredentialsProvider credentialsProvider) throws IOException {
        return BigQueryOptions.newBuilder()
            .setProjectId(resolveProjectId(properties, projectIdProvider))
            .setCredentials(credentialsProvider.getCredentials())
            .build()
            .getService();
    }

    @Bean
    public WarehouseClient warehouseClient(BigQuery bigQuery, FinopsProperties properties,
                                           GcpProjectIdProvider projectIdProvider) {
        return new BigQueryWarehouseClient(
            bigQuery,
            resolveProjectId(properties, projectIdProvider),
            properties.warehouse().queryTimeout());
    }

    private static String resolveProjectId(FinopsProperties properties, GcpProjectIdProvider projectIdProvider) {
        String configured = properties.warehouse().projectId();
        return configured != null && !configured.isBlank() ? configured : projectIdProvider.getProjectId();
    }
}
