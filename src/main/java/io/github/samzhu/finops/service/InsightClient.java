package io.github.samzhu.finops.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import io.github.samzhu.finops.client.llm.GenerationConfig;
import io.github.samzhu.finops.client.llm.GenerationResult;
import io.github.samzhu.finops.client.llm.GenerativeTextBackend;
import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.InsightPrompt;
import io.github.samzhu.finops.exception.GenerationException;

/**
 * 洞察產生用戶端。
 *
 * <p>以固定取樣參數 ({@code finops.insight.*}) 呼叫 {@link GenerativeTextBackend}：
 * <ul>
 *   <li>回傳第一個候選文字</li>
 *   <li>沒有任何候選 → {@link GenerationException}</li>
 *   <li>後端傳輸錯誤 → {@link GenerationException} (保留原始例外)</li>
 * </ul>
 *
 * <p>不自動重試。非同步版本在 {@code insightExecutor} 上執行，不佔用請求執行緒。
 */
@Component
public class InsightClient {

    private static final Logger log = LoggerFactory.getLogger(InsightClient.class);

    private final GenerativeTextBackend backend;
    private final GenerationConfig generationConfig;
    private final Executor executor;

    public InsightClient(GenerativeTextBackend backend,
                         FinopsProperties properties,
                         @Qualifier("insightExecutor") Executor executor) {
        FinopsProperties.InsightConfig insight = properties.insight();
        this.backend = backend;
        this.generationConfig = new GenerationConfig(
            insight.temperature(), insight.topP(), insight.topK(), insight.maxOutputTokens());
        this.executor = executor;
    }

    /**
     * 同步產生洞察文字。
     *
     * @throws GenerationException 沒有候選結果或後端失敗
     */
    public String generate(InsightPrompt prompt) {
        long startTime = System.currentTimeMillis();
        GenerationResult result = call(prompt);

        String text = result.text().orElseThrow(() -> {
            log.warn("Generation returned no candidates: model={}, type={}, finishReason={}",
                backend.model(), prompt.insightType(), result.finishReason());
            return new GenerationException(prompt.insightType(),
                "backend returned no response candidates (finishReason=" + result.finishReason() + ")");
        });

        log.info("Insight generated: model={}, type={}, records={}/{}, matching={}, truncated={}, {}ms",
            backend.model(), prompt.insightType(), prompt.includedRecords(), prompt.recordCount(),
            prompt.matchingRecords(), prompt.truncated(), System.currentTimeMillis() - startTime);
        return text;
    }

    private GenerationResult call(InsightPrompt prompt) {
        try {
            return backend.generate(prompt.text(), generationConfig);
        } catch (GenerativeTextBackend.BackendException e) {
            log.error("Generation backend failed: model={}, type={}, status={}",
                backend.model(), prompt.insightType(), e.getStatusCode(), e);
            throw new GenerationException(prompt.insightType(), e.getMessage(), e);
        }
    }

    /**
     * 在 {@code insightExecutor} 上產生洞察文字。
     */
    public CompletableFuture<String> generateAsync(InsightPrompt prompt) {
        return CompletableFuture.supplyAsync(() -> generate(prompt), executor);
    }

    GenerationConfig generationConfig() {
        return generationConfig;
    }
}
