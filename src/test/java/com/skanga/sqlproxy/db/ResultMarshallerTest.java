package com.skanga.sqlproxy.db;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResultMarshallerTest {
    @Mock
    ResultSet resultSet;

    @Mock
    ResultSetMetaData rsMeta;

    private final ResultMarshaller marshaller = new ResultMarshaller();

    @Test
    void scalarsPassThroughAndNullStaysNull() throws Exception {
        assertThat(marshaller.toJsonSafe(null)).isNull();
        assertThat(marshaller.toJsonSafe("text")).isEqualTo("text");
        assertThat(marshaller.toJsonSafe(true)).isEqualTo(true);
        assertThat(marshaller.toJsonSafe(42)).isEqualTo(42);
        assertThat(marshaller.toJsonSafe(42L)).isEqualTo(42L);
        assertThat(marshaller.toJsonSafe(1.5d)).isEqualTo(1.5d);
    }

    @Test
    void decimalsBecomePlainStrings() throws Exception {
        assertThat(marshaller.toJsonSafe(new BigDecimal("19.99"))).isEqualTo("19.99");
        assertThat(marshaller.toJsonSafe(new BigDecimal("1E+3"))).isEqualTo("1000");
        assertThat(marshaller.toJsonSafe(new BigDecimal("0.10000000000000000001"))).isEqualTo("0.10000000000000000001");
    }

    @Test
    void nonFiniteFloatingPointBecomesString() throws Exception {
        assertThat(marshaller.toJsonSafe(Double.NaN)).isEqualTo("NaN");
        assertThat(marshaller.toJsonSafe(Double.POSITIVE_INFINITY)).isEqualTo("Infinity");
        assertThat(marshaller.toJsonSafe(Float.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
    }

    @Test
    void temporalValuesBecomeIsoStrings() throws Exception {
        assertThat(marshaller.toJsonSafe(LocalDateTime.of(2024, 1, 15, 10, 30, 0)))
                .isEqualTo("2024-01-15T10:30:00");
        assertThat(marshaller.toJsonSafe(LocalDate.of(2024, 1, 15))).isEqualTo("2024-01-15");
        assertThat(marshaller.toJsonSafe(LocalTime.of(8, 5, 30))).isEqualTo("08:05:30");
        assertThat(marshaller.toJsonSafe(OffsetDateTime.of(2024, 1, 15, 10, 30, 0, 0, ZoneOffset.ofHours(2))))
                .isEqualTo("2024-01-15T10:30:00+02:00");
        assertThat(marshaller.toJsonSafe(java.sql.Timestamp.valueOf("2024-01-15 10:30:00.5")))
                .isEqualTo("2024-01-15T10:30:00.5");
        assertThat(marshaller.toJsonSafe(java.sql.Date.valueOf("2024-01-15"))).isEqualTo("2024-01-15");
    }

    @Test
    void binaryBecomesBase64AndUnknownTypesUseToString() throws Exception {
        UUID uuid = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");

        assertThat(marshaller.toJsonSafe(new byte[]{1, 2, 3})).isEqualTo("AQID");
        assertThat(marshaller.toJsonSafe(uuid)).isEqualTo("123e4567-e89b-12d3-a456-426614174000");
        assertThat(marshaller.toJsonSafe('x')).isEqualTo("x");
    }

    @Test
    void sqlArraysBecomeListsOfConvertedElements() throws Exception {
        Array sqlArray = org.mockito.Mockito.mock(Array.class);
        when(sqlArray.getArray()).thenReturn(new Object[]{new BigDecimal("1.50"), null, "a"});

        Object converted = marshaller.toJsonSafe(sqlArray);

        assertThat(converted).isEqualTo(Arrays.asList("1.50", null, "a"));
        verify(sqlArray).free();
    }

    @Test
    void primitiveArraysFromTheDriverAreConverted() throws Exception {
        Array intArray = org.mockito.Mockito.mock(Array.class);
        when(intArray.getArray()).thenReturn(new int[]{3, 1, 2});
        Array doubleArray = org.mockito.Mockito.mock(Array.class);
        when(doubleArray.getArray()).thenReturn(new double[]{0.5, Double.NaN});

        assertThat(marshaller.toJsonSafe(intArray)).isEqualTo(List.of(3, 1, 2));
        assertThat(marshaller.toJsonSafe(doubleArray)).isEqualTo(List.of(0.5, "NaN"));
        assertThat(marshaller.toJsonSafe(new long[]{7L})).isEqualTo(List.of(7L));
        verify(intArray).free();
        verify(doubleArray).free();
    }

    @Test
    void marshalUsesColumnLabelsAndKeepsDuplicates() throws Exception {
        when(resultSet.getMetaData()).thenReturn(rsMeta);
        when(rsMeta.getColumnCount()).thenReturn(3);
        when(rsMeta.getColumnLabel(1)).thenReturn("code");
        when(rsMeta.getColumnLabel(2)).thenReturn("code");
        when(rsMeta.getColumnLabel(3)).thenReturn("total");
        lenient().when(rsMeta.getColumnType(1)).thenReturn(Types.VARCHAR);
        lenient().when(rsMeta.getColumnType(2)).thenReturn(Types.VARCHAR);
        lenient().when(rsMeta.getColumnType(3)).thenReturn(Types.NUMERIC);
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getObject(1)).thenReturn("USD", "EUR");
        when(resultSet.getObject(2)).thenReturn("usd", null);
        when(resultSet.getObject(3)).thenReturn(new BigDecimal("10.00"), new BigDecimal("2.5"));

        QueryResult result = marshaller.marshal(resultSet);

        assertThat(result.columns()).containsExactly("code", "code", "total");
        assertThat(result.rowCount()).isEqualTo(2);
        assertThat(result.rows().get(0)).containsExactly("USD", "usd", "10.00");
        assertThat(result.rows().get(1)).containsExactly("EUR", null, "2.5");
    }

    @Test
    void marshalReadsTimestampsThroughJavaTime() throws Exception {
        when(resultSet.getMetaData()).thenReturn(rsMeta);
        when(rsMeta.getColumnCount()).thenReturn(2);
        when(rsMeta.getColumnLabel(1)).thenReturn("created_at");
        when(rsMeta.getColumnLabel(2)).thenReturn("logged_at");
        when(rsMeta.getColumnType(1)).thenReturn(Types.TIMESTAMP);
        when(rsMeta.getColumnType(2)).thenReturn(Types.TIMESTAMP);
        when(rsMeta.getColumnTypeName(1)).thenReturn("timestamp");
        when(rsMeta.getColumnTypeName(2)).thenReturn("timestamptz");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1, LocalDateTime.class)).thenReturn(LocalDateTime.of(2024, 3, 1, 12, 0));
        when(resultSet.getObject(2, OffsetDateTime.class))
                .thenReturn(OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC));

        QueryResult result = marshaller.marshal(resultSet);

        assertThat(result.rows().get(0)).containsExactly("2024-03-01T12:00:00", "2024-03-01T12:00:00Z");
    }

    @Test
    void queryResultEnvelopeHasSnakeCaseKeys() {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(Arrays.asList("USD", null));
        QueryResult result = new QueryResult(List.of("code", "symbol"), rows, 1, 12);

        ObjectNode json = marshaller.toJson(result);

        assertThat(json.get("columns").toString()).isEqualTo("[\"code\",\"symbol\"]");
        assertThat(json.get("rows").toString()).isEqualTo("[[\"USD\",null]]");
        assertThat(json.get("row_count").asInt()).isEqualTo(1);
        assertThat(json.get("execution_time_ms").asLong()).isEqualTo(12);
    }

    @Test
    void tablePageEnvelopeCarriesPagination() {
        TablePage tablePage = new TablePage(
                List.of(new TableMetadata("dict_currencies", TableType.BASE_TABLE, 16384L, 7, "Currency reference dictionary"),
                        new TableMetadata("active_currencies", TableType.VIEW, null, 2, null)),
                new PaginationInfo(1, 10, 2));

        ObjectNode json = marshaller.toJson(tablePage);

        assertThat(json.get("tables").size()).isEqualTo(2);
        assertThat(json.at("/tables/0/table_name").asText()).isEqualTo("dict_currencies");
        assertThat(json.at("/tables/0/table_type").asText()).isEqualTo("BASE TABLE");
        assertThat(json.at("/tables/0/table_size_bytes").asLong()).isEqualTo(16384L);
        assertThat(json.at("/tables/0/column_count").asInt()).isEqualTo(7);
        assertThat(json.at("/tables/1/table_type").asText()).isEqualTo("VIEW");
        assertThat(json.at("/tables/1/table_size_bytes").isNull()).isTrue();
        assertThat(json.at("/tables/1/table_comment").isNull()).isTrue();
        assertThat(json.at("/pagination/page").asInt()).isEqualTo(1);
        assertThat(json.at("/pagination/page_size").asInt()).isEqualTo(10);
        assertThat(json.at("/pagination/total_count").asInt()).isEqualTo(2);
        assertThat(json.at("/pagination/total_pages").asInt()).isEqualTo(1);
    }

    @Test
    void tableSchemaEnvelopeListsColumnsAndIndexes() {
        TableSchema tableSchema = new TableSchema(
                new TableMetadata("dict_currencies", TableType.BASE_TABLE, null, 2, "Currency reference dictionary"),
                List.of(new ColumnMetadata("id", "int4", false, true, false, null, 1, "nextval('dict_currencies_id_seq'::regclass)"),
                        new ColumnMetadata("code", "varchar(3)", false, false, false, "ISO 4217 currency code", 2, null)),
                List.of(new IndexMetadata("dict_currencies_pkey", List.of("id"), true, true)));

        ObjectNode json = marshaller.toJson(tableSchema);

        assertThat(json.get("table_name").asText()).isEqualTo("dict_currencies");
        assertThat(json.get("table_comment").asText()).isEqualTo("Currency reference dictionary");
        assertThat(json.get("column_count").asInt()).isEqualTo(2);
        assertThat(json.at("/columns/0/column_name").asText()).isEqualTo("id");
        assertThat(json.at("/columns/0/is_primary_key").asBoolean()).isTrue();
        assertThat(json.at("/columns/0/is_nullable").asBoolean()).isFalse();
        assertThat(json.at("/columns/1/data_type").asText()).isEqualTo("varchar(3)");
        assertThat(json.at("/columns/1/column_comment").asText()).isEqualTo("ISO 4217 currency code");
        assertThat(json.at("/columns/1/ordinal_position").asInt()).isEqualTo(2);
        assertThat(json.at("/indexes/0/index_name").asText()).isEqualTo("dict_currencies_pkey");
        assertThat(json.at("/indexes/0/columns/0").asText()).isEqualTo("id");
        assertThat(json.at("/indexes/0/is_unique").asBoolean()).isTrue();
        assertThat(json.at("/indexes/0/is_primary").asBoolean()).isTrue();
    }
}
