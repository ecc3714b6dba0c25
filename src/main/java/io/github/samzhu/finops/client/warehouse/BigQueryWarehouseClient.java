package io.github.samzhu.finops.client.warehouse;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.api.gax.paging.Page;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Dataset;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableDefinition;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableResult;
import com.google.cloud.bigquery.TimePartitioning;

import io.github.samzhu.finops.exception.ConfigurationException;
import io.github.samzhu.finops.exception.WarehouseException;

/**
 * 以 Google Cloud BigQuery client library 實作的 {@link WarehouseClient}。
 *
 * <p>錯誤對應：
 * <ul>
 *   <li>HTTP 400 / 403 / 404 → {@link ConfigurationException} (識別字錯誤、權限不足、不存在)</li>
 *   <li>其他 {@link BigQueryException} 與中斷 → {@link WarehouseException}</li>
 * </ul>
 *
 * <p>欄位值依 schema 的 Standard SQL 型別轉換，NUMERIC / FLOAT64 一律轉為 {@link BigDecimal}。
 *
 * @see <a href="https://cloud.google.com/bigquery/docs/parameterized-queries">Running parameterized queries</a>
 */
public class BigQueryWarehouseClient implements WarehouseClient {

    private static final Logger log = LoggerFactory.getLogger(BigQueryWarehouseClient.class);

    private static final String PARTITION_DATE = "_PARTITIONDATE";
    private static final String PARTITION_TIME = "_PARTITIONTIME";

    private final BigQuery bigQuery;
    private final String projectId;
    private final Duration queryTimeout;

    public BigQueryWarehouseClient(BigQuery bigQuery, String projectId, Duration queryTimeout) {
        this.bigQuery = bigQuery;
        this.projectId = projectId;
        this.queryTimeout = queryTimeout;
        log.info("BigQueryWarehouseClient initialized: projectId={}, queryTimeout={}", projectId, queryTimeout);
    }

    @Override
    public String projectId() {
        return projectId;
    }

    @Override
    public List<Map<String, Object>> runQuery(WarehouseQuery query) {
        QueryJobConfiguration.Builder builder = QueryJobConfiguration.newBuilder(query.sql())
            .setUseLegacySql(false)
            .setJobTimeoutMs(queryTimeout.toMillis());
        query.dateParameters().forEach((name, value) ->
            builder.addNamedParameter(name, QueryParameterValue.date(value.toString())));

        long startTime = System.currentTimeMillis();
        try {
            TableResult result = bigQuery.query(builder.build());
            FieldList fields = result.getSchema().getFields();

            List<Map<String, Object>> rows = new ArrayList<>();
            for (FieldValueList row : result.iterateAll()) {
                rows.add(toRow(fields, row));
            }

            log.debug("Query completed: {} rows in {}ms", rows.size(), System.currentTimeMillis() - startTime);
            return rows;
        } catch (BigQueryException e) {
            throw translate("query", e, null, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WarehouseException("query", "interrupted", e);
        }
    }

    @Override
    public DatasetPage listDatasets(int pageSize, String pageToken) {
        List<BigQuery.DatasetListOption> options = new ArrayList<>();
        options.add(BigQuery.DatasetListOption.pageSize(pageSize));
        if (pageToken != null && !pageToken.isBlank()) {
            options.add(BigQuery.DatasetListOption.pageToken(pageToken));
        }

        try {
            Page<Dataset> page = bigQuery.listDatasets(projectId,
                options.toArray(new BigQuery.DatasetListOption[0]));

            List<String> ids = new ArrayList<>();
            for (Dataset dataset : page.getValues()) {
                ids.add(dataset.getDatasetId().getDataset());
            }
            return new DatasetPage(projectId, ids, page.getNextPageToken());
        } catch (BigQueryException e) {
            throw translate("listDatasets", e, null, null);
        }
    }

    @Override
    public List<String> listTables(String datasetId) {
        WarehouseIdentifiers.requireDataset(datasetId);
        try {
            List<String> tables = new ArrayList<>();
            for (Table table : bigQuery.listTables(DatasetId.of(projectId, datasetId)).iterateAll()) {
                tables.add(table.getTableId().getTable());
            }
            return tables;
        } catch (BigQueryException e) {
            throw translate("listTables", e, datasetId, null);
        }
    }

    /**
     * 由資料表 metadata 判斷欄位是否存在。
     *
     * <p>{@code _PARTITIONDATE} / {@code _PARTITIONTIME} 不在 schema 中，
     * 只有 ingestion-time 分區 (沒有指定分區欄位的 DAY 分區) 才具備；
     * HOUR / MONTH / YEAR 分區沒有 {@code _PARTITIONDATE}，回傳 false 讓查詢改用事件時間欄位。
     */
    @Override
    public boolean columnExists(String datasetId, String tableId, String column) {
        WarehouseIdentifiers.requireTable(datasetId, tableId);
        try {
            Table table = bigQuery.getTable(TableId.of(projectId, datasetId, tableId));
            if (table == null) {
                throw new ConfigurationException(
                    String.format("Table not found: %s.%s.%s", projectId, datasetId, tableId),
                    datasetId, tableId);
            }

            TableDefinition definition = table.getDefinition();
            if (PARTITION_DATE.equalsIgnoreCase(column) || PARTITION_TIME.equalsIgnoreCase(column)) {
                return isIngestionTimePartitioned(definition);
            }

            Schema schema = definition.getSchema();
            if (schema == null) {
                return false;
            }
            return schema.getFields().stream()
                .anyMatch(field -> field.getName().equalsIgnoreCase(column));
        } catch (BigQueryException e) {
            throw translate("columnExists", e, datasetId, tableId);
        }
    }

    private static boolean isIngestionTimePartitioned(TableDefinition definition) {
        if (!(definition instanceof StandardTableDefinition standard)) {
            return false;
        }
        TimePartitioning partitioning = standard.getTimePartitioning();
        return partitioning != null
            && partitioning.getField() == null
            && partitioning.getType() == TimePartitioning.Type.DAY;
    }

    private static Map<String, Object> toRow(FieldList fields, FieldValueList row) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : fields) {
            values.put(field.getName(), toJava(field, row.get(field.getName())));
        }
        return values;
    }

    private static Object toJava(Field field, FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getAttribute() != FieldValue.Attribute.PRIMITIVE) {
            return value.getValue().toString();
        }

        StandardSQLTypeName type = field.getType().getStandardType();
        return switch (type) {
            case NUMERIC, BIGNUMERIC -> value.getNumericValue();
            case FLOAT64 -> BigDecimal.valueOf(value.getDoubleValue());
            case INT64 -> value.getLongValue();
            case BOOL -> value.getBooleanValue();
            case DATE -> LocalDate.parse(value.getStringValue());
            case TIMESTAMP -> Instant.EPOCH.plus(value.getTimestampValue(), ChronoUnit.MICROS);
            default -> value.getStringValue();
        };
    }

    private RuntimeException translate(String operation, BigQueryException e, String datasetId, String tableId) {
        int code = e.getCode();
        if (code == 400 || code == 403 || code == 404) {
            log.warn("BigQuery {} rejected: code={}, dataset={}, table={}, error={}",
                operation, code, datasetId, tableId, e.getMessage());
            return new ConfigurationException(
                String.format("BigQuery %s rejected (%d): %s", operation, code, e.getMessage()),
                datasetId, tableId, e);
        }
        log.error("BigQuery {} failed: code={}, dataset={}, table={}", operation, code, datasetId, tableId, e);
        return new WarehouseException(operation, e.getMessage(), e);
    }
}
