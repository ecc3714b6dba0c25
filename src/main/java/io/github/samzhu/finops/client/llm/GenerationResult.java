package io.github.samzhu.finops.client.llm;

import java.util.List;
import java.util.Optional;

/**
 * 文字生成結果。
 *
 * @param candidates 候選文字，可能為空
 * @param finishReason 第一個候選的結束原因，可能為 null
 */
public record GenerationResult(
    List<String> candidates,
    String finishReason
) {
    public GenerationResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    /**
     * 取得第一個候選文字。
     */
    public Optional<String> text() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }
}
