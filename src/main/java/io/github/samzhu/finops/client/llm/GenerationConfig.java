package io.github.samzhu.finops.client.llm;

/**
 * 文字生成的取樣參數。
 *
 * @param temperature 取樣溫度
 * @param topP nucleus sampling 機率
 * @param topK top-k 取樣數
 * @param maxOutputTokens 最大輸出 token 數
 */
public record GenerationConfig(
    double temperature,
    double topP,
    int topK,
    int maxOutputTokens
) {}
