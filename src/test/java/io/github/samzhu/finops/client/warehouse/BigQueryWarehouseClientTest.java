package io.github.samzhu.finops.client.warehouse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.QueryJobConfiguration;
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

class BigQueryWarehouseClientTest {

    private BigQuery bigQuery;
    private BigQueryWarehouseClient client;

    @BeforeEach
    void setUp() {
        bigQuery = mock(BigQuery.class);
        client = new BigQueryWarehouseClient(bigQuery, "acme-billing", Duration.ofMinutes(5));
    }

    // ========== columnExists ==========

    @Test
    void shouldFindColumnInSchemaIgnoringCase() {
        // Given
        givenTable(StandardTableDefinition.newBuilder()
            .setSchema(Schema.of(
                Field.of("usage_start_time", StandardSQLTypeName.TIMESTAMP),
                Field.of("cost", StandardSQLTypeName.NUMERIC)))
            .build());

        // When / Then
        assertThat(client.columnExists("billing", "gcp_export", "USAGE_START_TIME")).isTrue();
        assertThat(client.columnExists("billing", "gcp_export", "invoice_month")).isFalse();
        verify(bigQuery, times(2)).getTable(TableId.of("acme-billing", "billing", "gcp_export"));
    }

    @Test
    void shouldExposePartitionDateOnDailyIngestionTimeTable() {
        givenTable(StandardTableDefinition.newBuilder()
            .setSchema(Schema.of(Field.of("cost", StandardSQLTypeName.NUMERIC)))
            .setTimePartitioning(TimePartitioning.of(TimePartitioning.Type.DAY))
            .build());

        assertThat(client.columnExists("billing", "gcp_export", "_PARTITIONDATE")).isTrue();
        assertThat(client.columnExists("billing", "gcp_export", "_PARTITIONTIME")).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = TimePartitioning.Type.class, names = {"HOUR", "MONTH", "YEAR"})
    void shouldNotExposePartitionDateOnNonDailyPartitioning(TimePartitioning.Type type) {
        // Given: ingestion-time 分區但不是 DAY
        givenTable(StandardTableDefinition.newBuilder()
            .setSchema(Schema.of(Field.of("cost", StandardSQLTypeName.NUMERIC)))
            .setTimePartitioning(TimePartitioning.of(type))
            .build());

        // When / Then
        assertThat(client.columnExists("billing", "gcp_export", "_PARTITIONDATE")).isFalse();
    }

    @Test
    void shouldNotExposePartitionDateOnColumnPartitionedTable() {
        givenTable(StandardTableDefinition.newBuilder()
            .setSchema(Schema.of(Field.of("usage_start_time", StandardSQLTypeName.TIMESTAMP)))
            .setTimePartitioning(TimePartitioning.newBuilder(TimePartitioning.Type.DAY)
                .setField("usage_start_time")
                .build())
            .build());

        assertThat(client.columnExists("billing", "gcp_export", "_PARTITIONDATE")).isFalse();
    }

    @Test
    void shouldNotExposePartitionDateOnUnpartitionedTable() {
        givenTable(StandardTableDefinition.newBuilder()
            .setSchema(Schema.of(Field.of("cost", StandardSQLTypeName.NUMERIC)))
            .build());

        assertThat(client.columnExists("billing", "gcp_export", "_PARTITIONDATE")).isFalse();
    }

    @Test
    void shouldTreatMissingTableAsConfigurationError() {
        when(bigQuery.getTable(any(TableId.class))).thenReturn(null);

        assertThatThrownBy(() -> client.columnExists("billing", "gcp_export", "_PARTITIONDATE"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessage("Table not found: acme-billing.billing.gcp_export")
            .satisfies(e -> {
                ConfigurationException ce = (ConfigurationException) e;
                assertThat(ce.getDatasetId()).isEqualTo("billing");
                assertThat(ce.getTableId()).isEqualTo("gcp_export");
            });
    }

    @Test
    void shouldRejectInvalidIdentifiersBeforeCallingBigQuery() {
        assertThatThrownBy(() -> client.columnExists("billing`;", "gcp_export", "cost"))
            .isInstanceOf(ConfigurationException.class);
        verifyNoInteractions(bigQuery);
    }

    // ========== 錯誤對應 ==========

    @ParameterizedTest
    @ValueSource(ints = {400, 403, 404})
    void shouldMapClientErrorsToConfigurationException(int code) {
        when(bigQuery.getTable(any(TableId.class))).thenThrow(new BigQueryException(code, "Access Denied"));

        assertThatThrownBy(() -> client.columnExists("billing", "gcp_export", "cost"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("BigQuery columnExists rejected (" + code + ")")
            .hasCauseInstanceOf(BigQueryException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {500, 503})
    void shouldMapServerErrorsToWarehouseException(int code) {
        when(bigQuery.getTable(any(TableId.class))).thenThrow(new BigQueryException(code, "Backend Error"));

        assertThatThrownBy(() -> client.columnExists("billing", "gcp_export", "cost"))
            .isInstanceOf(WarehouseException.class)
            .satisfies(e -> assertThat(((WarehouseException) e).getOperation()).isEqualTo("columnExists"));
    }

    @Test
    void shouldMapQueryFailures() throws Exception {
        when(bigQuery.query(any(QueryJobConfiguration.class)))
            .thenThrow(new BigQueryException(400, "Unrecognized name: _PARTITIONDATE"));

        assertThatThrownBy(() -> client.runQuery(WarehouseQuery.of("SELECT 1")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Unrecognized name: _PARTITIONDATE");
    }

    // ========== runQuery ==========

    @Test
    void shouldBindDateParametersAndConvertRowValues() throws Exception {
        // Given
        Schema schema = Schema.of(
            Field.of("service", StandardSQLTypeName.STRING),
            Field.of("time_period", StandardSQLTypeName.DATE),
            Field.of("cost", StandardSQLTypeName.NUMERIC),
            Field.of("usage_amount", StandardSQLTypeName.FLOAT64),
            Field.of("rows", StandardSQLTypeName.INT64),
            Field.of("exported_at", StandardSQLTypeName.TIMESTAMP),
            Field.of("usage_unit", StandardSQLTypeName.STRING));
        FieldValueList row = FieldValueList.of(Arrays.asList(
            primitive("Compute Engine"),
            primitive("2025-01-15"),
            primitive("12.345"),
            primitive("1.5"),
            primitive("3"),
            primitive("1736899200.0"),
            primitive(null)), schema.getFields());

        TableResult result = mock(TableResult.class);
        when(result.getSchema()).thenReturn(schema);
        when(result.iterateAll()).thenReturn(List.of(row));
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenReturn(result);

        Map<String, LocalDate> params = new LinkedHashMap<>();
        params.put("start_date", LocalDate.of(2025, 1, 1));
        params.put("end_date", LocalDate.of(2025, 1, 31));

        // When
        List<Map<String, Object>> rows = client.runQuery(new WarehouseQuery("SELECT ...", params));

        // Then
        assertThat(rows).hasSize(1);
        Map<String, Object> values = rows.get(0);
        assertThat(values).containsKeys("service", "time_period", "cost", "usage_amount", "rows", "exported_at", "usage_unit");
        assertThat(values.get("service")).isEqualTo("Compute Engine");
        assertThat(values.get("time_period")).isEqualTo(LocalDate.of(2025, 1, 15));
        assertThat((BigDecimal) values.get("cost")).isEqualByComparingTo("12.345");
        assertThat((BigDecimal) values.get("usage_amount")).isEqualByComparingTo("1.5");
        assertThat(values.get("rows")).isEqualTo(3L);
        assertThat(values.get("exported_at")).isEqualTo(Instant.parse("2025-01-15T00:00:00Z"));
        assertThat(values.get("usage_unit")).isNull();

        ArgumentCaptor<QueryJobConfiguration> config = ArgumentCaptor.forClass(QueryJobConfiguration.class);
        verify(bigQuery).query(config.capture());
        assertThat(config.getValue().useLegacySql()).isFalse();
        assertThat(config.getValue().getNamedParameters().get("start_date").getValue()).isEqualTo("2025-01-01");
        assertThat(config.getValue().getNamedParameters().get("end_date").getValue()).isEqualTo("2025-01-31");
    }

    @Test
    void shouldWrapInterruptedQuery() throws Exception {
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenThrow(new InterruptedException());

        assertThatThrownBy(() -> client.runQuery(WarehouseQuery.of("SELECT 1")))
            .isInstanceOf(WarehouseException.class)
            .hasCauseInstanceOf(InterruptedException.class);
        assertThat(Thread.interrupted()).isTrue();
    }

    private void givenTable(TableDefinition definition) {
        Table table = mock(Table.class);
        when(table.<TableDefinition>getDefinition()).thenReturn(definition);
        when(bigQuery.getTable(any(TableId.class))).thenReturn(table);
    }

    private static FieldValue primitive(String value) {
        return FieldValue.of(FieldValue.Attribute.PRIMITIVE, value);
    }
}
