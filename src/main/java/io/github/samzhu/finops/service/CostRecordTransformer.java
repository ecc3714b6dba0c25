package io.github.samzhu.finops.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

import org.bson.types.Decimal128;
import org.springframework.stereotype.Component;

import io.github.samzhu.finops.document.CostRecord;
import io.github.samzhu.finops.exception.TransformException;

/**
 * 倉儲查詢結果列 → {@link CostRecord} 轉換器。
 *
 * <p>欄位對應 (見 {@link BillingQueryBuilder} 產生的欄位別名)：
 * <ul>
 *   <li>{@code service}、{@code project}、{@code sku} - 必填，不可空白</li>
 *   <li>{@code time_period} - 必填，接受 {@link LocalDate}、日期時間型別或 ISO 字串，轉為 UTC 日期</li>
 *   <li>{@code cost} - 必填，接受 {@link Number} 或數字字串，必須能以 Decimal128 精確表示</li>
 *   <li>{@code currency} - 必填</li>
 *   <li>{@code usage_amount}、{@code usage_unit} - 選填，不存在時保留 null，不轉成 0</li>
 * </ul>
 *
 * <p>任何一列轉換失敗即拋出 {@link TransformException}，整批中止，不做略過。
 */
@Component
public class CostRecordTransformer {

    static final String SERVICE = "service";
    static final String PROJECT = "project";
    static final String SKU = "sku";
    static final String TIME_PERIOD = "time_period";
    static final String COST = "cost";
    static final String CURRENCY = "currency";
    static final String USAGE_AMOUNT = "usage_amount";
    static final String USAGE_UNIT = "usage_unit";

    /**
     * 轉換整批資料列。
     *
     * @param rows 倉儲查詢結果
     * @return 轉換後的紀錄，順序與輸入相同
     * @throws TransformException 任何一列格式錯誤
     */
    public List<CostRecord> transformAll(List<Map<String, Object>> rows) {
        List<CostRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(transform(rows.get(i), i));
        }
        return records;
    }

    /**
     * 轉換單一資料列。
     *
     * @param row 倉儲查詢結果列
     * @param index 在批次中的位置，用於錯誤訊息
     * @throws TransformException 格式錯誤
     */
    public CostRecord transform(Map<String, Object> row, int index) {
        if (row == null) {
            throw new TransformException("row is null", null, index);
        }

        String service = requireText(row, SERVICE, index);
        String project = requireText(row, PROJECT, index);
        String sku = requireText(row, SKU, index);
        LocalDate timePeriod = toDate(row, TIME_PERIOD, index);

        BigDecimal cost = toDecimal(row, COST, index);
        if (cost == null) {
            throw new TransformException("missing cost", row, index);
        }
        String currency = requireText(row, CURRENCY, index);

        BigDecimal usageAmount = toDecimal(row, USAGE_AMOUNT, index);
        Object unit = row.get(USAGE_UNIT);
        String usageUnit = unit == null ? null : unit.toString();

        return CostRecord.of(service, project, sku, timePeriod, cost, currency, usageAmount, usageUnit);
    }

    private static String requireText(Map<String, Object> row, String field, int index) {
        Object value = row.get(field);
        if (value == null || value.toString().isBlank()) {
            throw new TransformException("missing " + field, row, index);
        }
        return value.toString();
    }

    private static BigDecimal toDecimal(Map<String, Object> row, String field, int index) {
        BigDecimal decimal = parseDecimal(row, field, index);
        if (decimal == null) {
            return null;
        }
        // 儲存為 Decimal128，不能精確表示的值在這裡擋下
        try {
            new Decimal128(decimal);
        } catch (NumberFormatException e) {
            throw new TransformException(
                field + " exceeds Decimal128 precision: '" + decimal.toPlainString() + "'", row, index, e);
        }
        return decimal;
    }

    private static BigDecimal parseDecimal(Map<String, Object> row, String field, int index) {
        Object value = row.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            if (value instanceof Double || value instanceof Float) {
                return BigDecimal.valueOf(((Number) value).doubleValue());
            }
            if (value instanceof Number number) {
                return new BigDecimal(number.toString());
            }
            if (value instanceof String text) {
                return new BigDecimal(text.trim());
            }
        } catch (NumberFormatException e) {
            throw new TransformException("non-numeric " + field + ": '" + value + "'", row, index, e);
        }
        throw new TransformException(
            "unsupported " + field + " type: " + value.getClass().getSimpleName(), row, index);
    }

    private static LocalDate toDate(Map<String, Object> row, String field, int index) {
        Object value = row.get(field);
        if (value == null) {
            throw new TransformException("missing " + field, row, index);
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.atZoneSameInstant(ZoneOffset.UTC).toLocalDate();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.withZoneSameInstant(ZoneOffset.UTC).toLocalDate();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC).toLocalDate();
        }
        if (value instanceof Date date) {
            return Instant.ofEpochMilli(date.getTime()).atOffset(ZoneOffset.UTC).toLocalDate();
        }
        if (value instanceof String text) {
            return parseDate(text.trim(), row, index);
        }
        throw new TransformException(
            "unsupported " + field + " type: " + value.getClass().getSimpleName(), row, index);
    }

    private static LocalDate parseDate(String text, Map<String, Object> row, int index) {
        try {
            if (text.length() <= 10) {
                return LocalDate.parse(text);
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(text).atZoneSameInstant(ZoneOffset.UTC).toLocalDate();
            }
            return LocalDateTime.parse(text).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new TransformException("unparsable " + TIME_PERIOD + ": '" + text + "'", row, index, e);
        }
    }
}
