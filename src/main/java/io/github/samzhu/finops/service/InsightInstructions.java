package io.github.samzhu.finops.service;

import java.util.Locale;

/**
 * 洞察類型 → 分析指示的對應。
 *
 * <p>類型為開放集合，未知類型一律使用通用指示 (若有查詢文字則轉述查詢)。
 * 別名：{@code spend_summary} 同 {@code summary}、{@code anomaly_detection} 同 {@code anomaly}、
 * {@code cost_optimization} 同 {@code recommendation}。
 */
public final class InsightInstructions {

    public static final String SUMMARY = "summary";
    public static final String SPEND_SUMMARY = "spend_summary";
    public static final String ANOMALY = "anomaly";
    public static final String ROOT_CAUSE = "root_cause";
    public static final String PREDICTION = "prediction";
    public static final String RECOMMENDATION = "recommendation";
    public static final String NATURAL_QUERY = "natural_query";

    private InsightInstructions() {
        // 工具類不允許實例化
    }

    /**
     * 正規化洞察類型 (去除空白、轉小寫)，空值視為 {@code summary}。
     */
    public static String normalize(String insightType) {
        if (insightType == null || insightType.isBlank()) {
            return SUMMARY;
        }
        return insightType.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 取得分析指示，接在 "Based on this data, please " 之後。
     *
     * @param insightType 洞察類型
     * @param query 使用者查詢，可為 null
     */
    public static String forType(String insightType, String query) {
        String type = normalize(insightType);
        return switch (type) {
            case SUMMARY, SPEND_SUMMARY -> "summarize the cloud spend trends and key cost drivers";
            case ANOMALY, "anomaly_detection" ->
                "identify any unusual spending patterns or anomalies and explain them";
            case ROOT_CAUSE ->
                "attribute the main cost changes to the specific services, projects and SKUs that drive them";
            case PREDICTION ->
                "project the spend for the coming period and state the assumptions behind the projection";
            case RECOMMENDATION, "cost_optimization" ->
                "provide specific and actionable cost optimization recommendations grouped by category, "
                    + "with estimated savings where the data allows";
            case NATURAL_QUERY ->
                "answer the following question: \"" + (query == null ? "" : query.trim()) + "\". "
                    + "If the data is insufficient to answer it, say so explicitly";
            default -> query != null && !query.isBlank()
                ? "address the following request: \"" + query.trim() + "\""
                : "provide the key insights from this data";
        };
    }
}
