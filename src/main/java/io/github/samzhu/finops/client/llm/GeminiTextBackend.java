package io.github.samzhu.finops.client.llm;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Gemini {@code generateContent} REST API 的 {@link GenerativeTextBackend} 實作。
 *
 * <p>請求格式：
 * <pre>
 * POST {baseUrl}/models/{model}:generateContent?key={apiKey}
 * {
 *   "contents": [{"role": "user", "parts": [{"text": "..."}]}],
 *   "generationConfig": {"temperature": 0.2, "topP": 0.8, "topK": 40, "maxOutputTokens": 1024}
 * }
 * </pre>
 *
 * <p>回應中每個 candidate 的 {@code content.parts[].text} 串接為一個候選文字；
 * 沒有文字內容的 candidate (例如被安全過濾) 會被略過。
 *
 * @see <a href="https://ai.google.dev/api/generate-content">Gemini API - Generating content</a>
 */
public class GeminiTextBackend implements GenerativeTextBackend {

    private static final Logger log = LoggerFactory.getLogger(GeminiTextBackend.class);

    private final RestClient restClient;
    private final String model;
    private final String apiKey;

    public GeminiTextBackend(RestClient restClient, String model, String apiKey) {
        this.restClient = restClient;
        this.model = model;
        this.apiKey = apiKey;
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API key is not configured, insight generation will be rejected by the backend");
        }
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public GenerationResult generate(String prompt, GenerationConfig config) {
        GenerateContentRequest request = new GenerateContentRequest(
            List.of(new Content("user", List.of(new Part(prompt)))),
            new RequestGenerationConfig(config.temperature(), config.topP(), config.topK(), config.maxOutputTokens()));

        long startTime = System.currentTimeMillis();
        GenerateContentResponse response;
        try {
            response = restClient.post()
                .uri("/models/{model}:generateContent?key={key}", model, apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientResponseException e) {
            throw new BackendException(
                String.format("Gemini responded %d: %s", e.getStatusCode().value(), e.getResponseBodyAsString()),
                e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new BackendException("Gemini request failed: " + e.getMessage(), 0, e);
        }

        GenerationResult result = toResult(response);
        log.debug("Gemini generateContent: model={}, promptChars={}, candidates={}, {}ms",
            model, prompt.length(), result.candidates().size(), System.currentTimeMillis() - startTime);
        return result;
    }

    private static GenerationResult toResult(GenerateContentResponse response) {
        if (response == null || response.candidates() == null) {
            return new GenerationResult(List.of(), null);
        }

        List<String> texts = response.candidates().stream()
            .map(Candidate::text)
            .filter(Objects::nonNull)
            .toList();
        String finishReason = response.candidates().isEmpty() ? null : response.candidates().get(0).finishReason();
        return new GenerationResult(texts, finishReason);
    }

    // ========== Gemini JSON 結構 ==========

    record GenerateContentRequest(List<Content> contents, RequestGenerationConfig generationConfig) {}

    record RequestGenerationConfig(double temperature, double topP, int topK, int maxOutputTokens) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(String role, List<Part> parts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content, String finishReason) {

        String text() {
            if (content == null || content.parts() == null || content.parts().isEmpty()) {
                return null;
            }
            StringBuilder sb = new StringBuilder();
            for (Part part : content.parts()) {
                if (part.text() != null) {
                    sb.append(part.text());
                }
            }
            return sb.isEmpty() ? null : sb.toString();
        }
    }
}
