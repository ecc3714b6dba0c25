package io.github.samzhu.finops.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link FinopsProperties} 的型別安全配置綁定，並註冊：
 * <ul>
 *   <li>{@link Clock} - UTC 時鐘，指標計算的「現在」一律由此取得，測試可替換為固定時鐘</li>
 *   <li>{@code warehouseExecutor} - BigQuery 匯入與瀏覽的阻塞呼叫</li>
 *   <li>{@code insightExecutor} - Gemini 洞察產生的阻塞呼叫</li>
 * </ul>
 *
 * <p>兩個執行緒池彼此獨立，長時間的帳單匯入不會佔用洞察請求的執行緒。
 *
 * @see FinopsProperties
 * @see <a href="https://docs.spring.io/spring-framework/reference/integration/scheduling.html#scheduling-task-executor">Spring TaskExecutor</a>
 */
@Configuration
@EnableConfigurationProperties(FinopsProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskExecutor warehouseExecutor(FinopsProperties properties) {
        return executor("warehouse-", properties.executor().warehousePoolSize());
    }

    @Bean
    public ThreadPoolTaskExecutor insightExecutor(FinopsProperties properties) {
        return executor("insight-", properties.executor().insightPoolSize());
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
