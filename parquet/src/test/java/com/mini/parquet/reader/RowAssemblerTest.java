package com.mini.parquet.reader;

import com.mini.parquet.data.DynamicValue;
import com.mini.parquet.data.RowRecord;
import com.mini.parquet.format.ColumnField;
import com.mini.parquet.format.PhysicalKind;
import com.mini.parquet.format.TypedValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RowAssembler 测试
 */
public class RowAssemblerTest {

    private static final List<ColumnField> FIELDS = Arrays.asList(
            new ColumnField("id", "INT64", PhysicalKind.INT64, false, false, null),
            new ColumnField("name", "BINARY", PhysicalKind.BYTE_ARRAY, false, false, "STRING"),
            new ColumnField("age", "INT32", PhysicalKind.INT32, true, false, null));

    private static final List<TypedValue> ROW = Arrays.asList(
            TypedValue.of(PhysicalKind.INT64, 7L),
            TypedValue.of(PhysicalKind.BYTE_ARRAY, "Alice".getBytes(StandardCharsets.UTF_8)),
            TypedValue.of(PhysicalKind.INT32, 30));

    @Test
    public void testProjectionKeepsSchemaOrder() {
        Set<String> projection = new LinkedHashSet<>(Arrays.asList("name", "id"));

        RowRecord record = RowAssembler.assemble(FIELDS, ROW, projection);

        assertEquals(Arrays.asList("id", "name"), new ArrayList<>(record.columns()));
        assertEquals(DynamicValue.ofInt64(7L), record.get("id"));
        assertEquals(DynamicValue.ofUtf8("Alice"), record.get("name"));
        assertFalse(record.contains("age"));
    }

    @Test
    public void testEmptyProjectionIncludesAllColumns() {
        RowRecord record = RowAssembler.assemble(FIELDS, ROW, Collections.emptySet());
        assertEquals(Arrays.asList("id", "name", "age"), new ArrayList<>(record.columns()));
    }

    @Test
    public void testNullProjectionIncludesAllColumns() {
        RowRecord record = RowAssembler.assemble(FIELDS, ROW, null);
        assertEquals(3, record.size());
    }

    @Test
    public void testUnknownProjectionNamesIgnored() {
        Set<String> projection = new LinkedHashSet<>(Arrays.asList("id", "salary"));

        RowRecord record = RowAssembler.assemble(FIELDS, ROW, projection);

        assertEquals(Collections.singletonList("id"), new ArrayList<>(record.columns()));
    }

    @Test
    public void testMissingPositionsAreOmitted() {
        List<TypedValue> shortRow = Arrays.asList(TypedValue.of(PhysicalKind.INT64, 1L), null);

        RowRecord record = RowAssembler.assemble(FIELDS, shortRow, null);

        assertEquals(Collections.singletonList("id"), new ArrayList<>(record.columns()));
    }

    @Test
    public void testNullValueKeptAsNull() {
        List<TypedValue> row = Arrays.asList(
                TypedValue.of(PhysicalKind.INT64, 1L),
                TypedValue.of(PhysicalKind.BYTE_ARRAY, "Bob".getBytes(StandardCharsets.UTF_8)),
                TypedValue.nullOf(PhysicalKind.INT32));

        RowRecord record = RowAssembler.assemble(FIELDS, row, null);

        assertTrue(record.contains("age"));
        assertTrue(record.get("age").isNull());
        assertNull(record.toMap().get("age"));
        assertTrue(record.toMap().containsKey("age"));
    }
}
