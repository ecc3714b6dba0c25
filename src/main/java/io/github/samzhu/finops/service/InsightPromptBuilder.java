package io.github.samzhu.finops.service;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.dto.InsightPrompt;
import io.github.samzhu.finops.dto.InsightScope;

/**
 * 洞察 prompt 組裝器。
 *
 * <p>Prompt 結構：
 * <ol>
 *   <li>開場說明</li>
 *   <li>資料範圍 (只列出有指定的條件)</li>
 *   <li>成本紀錄，每筆一行；載入時已截取時註明筆數</li>
 *   <li>依洞察類型決定的分析指示 ({@link InsightInstructions})</li>
 * </ol>
 *
 * <p>紀錄區段超過 {@code finops.insight.max-input-chars} 時，只保留放得下的完整行，
 * 再接上 {@link #TRUNCATION_MARKER}，並記錄 WARN。不會因長度而拋出例外。
 */
@Component
public class InsightPromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(InsightPromptBuilder.class);

    public static final String TRUNCATION_MARKER = "... (additional records omitted)";

    static final String PREAMBLE = "Analyze the following cloud spend data:";
    static final String CLOSING = "Be concise, clear, and actionable. Focus on key insights.";
    static final String NO_MATCHING_RECORDS = "(no cost records matched the requested scope)";
    static final String CAPPED_NOTE = "(showing the %d most recent of %d matching records)";

    private final int maxInputChars;

    public InsightPromptBuilder(FinopsProperties properties) {
        this.maxInputChars = properties.insight().maxInputChars();
    }

    /**
     * 組裝 prompt。
     *
     * @param insightType 洞察類型
     * @param query 使用者查詢，可為 null
     * @param scope 資料範圍
     * @param records 成本紀錄
     */
    public InsightPrompt build(String insightType, String query, InsightScope scope, List<CostRecord> records) {
        return build(insightType, query, scope, records, records.size());
    }

    /**
     * 組裝 prompt，{@code matchingRecords} 大於載入筆數時在紀錄後註明只涵蓋最新的部分。
     *
     * @param matchingRecords 範圍內符合條件的總筆數
     */
    public InsightPrompt build(String insightType, String query, InsightScope scope,
            List<CostRecord> records, long matchingRecords) {
        String type = InsightInstructions.normalize(insightType);
        String instruction = InsightInstructions.forType(type, query);

        if (records.isEmpty() && !InsightInstructions.NATURAL_QUERY.equals(type)) {
            return new InsightPrompt("No data available to " + instruction + ".", type, 0, 0, 0, false, false);
        }

        Section data = serialize(records);

        StringBuilder prompt = new StringBuilder(PREAMBLE).append("\n\n");
        String header = scopeHeader(scope);
        if (!header.isEmpty()) {
            prompt.append(header).append("\n\n");
        }
        prompt.append(records.isEmpty() ? NO_MATCHING_RECORDS : data.text()).append("\n\n");
        if (matchingRecords > records.size()) {
            prompt.append(String.format(CAPPED_NOTE, records.size(), matchingRecords)).append("\n\n");
        }
        prompt            .append("Based on this data, please ").append(instruction).append(". ")
            .append(CLOSING);

        return new InsightPrompt(prompt.toString(), type, records.size(),
            Math.max(matchingRecords, records.size()), data.includedRecords(), data.truncated(), !records.isEmpty());
    }

    /**
     * 將紀錄序列化為每筆一行，超過上限時於行邊界截斷。
     */
    Section serialize(List<CostRecord> records) {
        List<String> lines = new ArrayList<>(records.size());
        int fullLength = 0;
        for (CostRecord record : records) {
            String line = formatRecord(record);
            fullLength += line.length() + (lines.isEmpty() ? 0 : 1);
            lines.add(line);
        }

        if (fullLength <= maxInputChars) {
            return new Section(String.join("\n", lines), lines.size(), false);
        }

        StringBuilder kept = new StringBuilder();
        int included = 0;
        for (String line : lines) {
            int needed = line.length() + (included == 0 ? 0 : 1);
            if (kept.length() + needed > maxInputChars) {
                break;
            }
            if (included > 0) {
                kept.append('\n');
            }
            kept.append(line);
            included++;
        }
        if (included > 0) {
            kept.append('\n');
        }
        kept.append(TRUNCATION_MARKER);

        log.warn("Insight input truncated from {} to {} characters ({} of {} records). "
                + "Consider narrowing the scope for a more targeted analysis",
            fullLength, kept.length(), included, records.size());
        return new Section(kept.toString(), included, true);
    }

    /**
     * 單筆紀錄的文字格式，例如：
     * {@code - Service: Compute Engine, Project: proj-a, SKU: N1 Core, Time: 2025-01-15, Cost: 10.00 USD, Usage: 24 hour}
     */
    static String formatRecord(CostRecord record) {
        String usage = record.usageAmount() == null
            ? "N/A"
            : record.usageAmount().stripTrailingZeros().toPlainString()
                + (record.usageUnit() == null ? "" : " " + record.usageUnit());
        return String.format("- Service: %s, Project: %s, SKU: %s, Time: %s, Cost: %s %s, Usage: %s",
            record.service(), record.project(), record.sku(), record.timePeriod(),
            record.cost().setScale(2, RoundingMode.HALF_UP).toPlainString(), record.currency(), usage);
    }

    static String scopeHeader(InsightScope scope) {
        if (scope == null || scope.isEmpty()) {
            return "";
        }
        List<String> clauses = new ArrayList<>();
        if (scope.project() != null) {
            clauses.add("Project: " + scope.project());
        }
        if (scope.service() != null) {
            clauses.add("Service: " + scope.service());
        }
        if (scope.sku() != null) {
            clauses.add("SKU: " + scope.sku());
        }
        if (scope.startDate() != null && scope.endDate() != null) {
            clauses.add("Period: " + scope.startDate() + " to " + scope.endDate());
        } else if (scope.startDate() != null) {
            clauses.add("Period: from " + scope.startDate());
        } else if (scope.endDate() != null) {
            clauses.add("Period: until " + scope.endDate());
        }
        return "Scope: " + String.join(", ", clauses);
    }

    record Section(String text, int includedRecords, boolean truncated) {}
}
