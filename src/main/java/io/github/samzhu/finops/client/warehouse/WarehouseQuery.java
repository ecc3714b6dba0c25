package io.github.samzhu.finops.client.warehouse;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 參數化的倉儲查詢。
 *
 * <p>SQL 中以 {@code @name} 引用具名參數，值一律透過參數綁定傳入，不做字串拼接。
 * 目前僅使用 DATE 型別參數。
 *
 * @param sql 查詢語句
 * @param dateParameters 具名 DATE 參數 (保留插入順序)
 */
public record WarehouseQuery(
    String sql,
    Map<String, LocalDate> dateParameters
) {
    public WarehouseQuery {
        dateParameters = dateParameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(dateParameters));
    }

    public static WarehouseQuery of(String sql) {
        return new WarehouseQuery(sql, Map.of());
    }
}
