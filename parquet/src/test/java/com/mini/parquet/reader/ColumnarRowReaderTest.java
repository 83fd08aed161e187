package com.mini.parquet.reader;

import com.mini.parquet.data.DynamicValue;
import com.mini.parquet.data.RowRecord;
import com.mini.parquet.testutils.InMemoryColumnarFile;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ColumnarRowReader 测试
 * 使用内存中的多行组文件验证遍历顺序、跳过和限制
 */
public class ColumnarRowReaderTest {

    @Test
    public void testReadsRowGroupsInStorageOrder() throws IOException {
        InMemoryColumnarFile file = new InMemoryColumnarFile("mem", 3, 2, 4);

        List<RowRecord> rows = readAll(file, ReadOptions.all());

        assertEquals(9, rows.size());
        for (int i = 0; i < rows.size(); i++) {
            assertEquals(DynamicValue.ofInt64(i), rows.get(i).get("id"));
        }
        assertTrue(file.isClosed());
    }

    @Test
    public void testSkipAcrossRowGroupsBypassesWholeGroups() throws IOException {
        InMemoryColumnarFile file = new InMemoryColumnarFile("mem", 3, 2, 4);

        List<RowRecord> rows = readAll(file, ReadOptions.builder().skipRows(6).build());

        assertEquals(3, rows.size());
        assertEquals(DynamicValue.ofInt64(6), rows.get(0).get("id"));
        assertEquals(2, file.getGroupsSkipped());
        assertEquals(1, file.getGroupsOpened());
        // 第三个行组中被跳过的第一行仍然需要解码
        assertEquals(4, file.getRowsRead());
    }

    @Test
    public void testSkipEndingOnGroupBoundary() throws IOException {
        InMemoryColumnarFile file = new InMemoryColumnarFile("mem", 3, 2, 4);

        List<RowRecord> rows = readAll(file, ReadOptions.builder().skipRows(5).build());

        assertEquals(4, rows.size());
        assertEquals(DynamicValue.ofInt64(5), rows.get(0).get("id"));
        assertEquals(2, file.getGroupsSkipped());
    }

    @Test
    public void testLimitStopsBeforeRemainingGroups() throws IOException {
        InMemoryColumnarFile file = new InMemoryColumnarFile("mem", 3, 2, 4);

        List<RowRecord> rows = readAll(file, ReadOptions.builder().rowLimit(4).build());

        assertEquals(4, rows.size());
        assertEquals(DynamicValue.ofInt64(3), rows.get(3).get("id"));
        assertEquals(2, file.getGroupsOpened());
        assertEquals(4, file.getRowsRead());
    }

    @Test
    public void testSkipAndLimitWithProjection() throws IOException {
        InMemoryColumnarFile file = new InMemoryColumnarFile("mem", 3, 2, 4);
        ReadOptions options = ReadOptions.builder().skipRows(2).rowLimit(3).columns("name").build();

        List<RowRecord> rows = readAll(file, options);

        assertEquals(3, rows.size());
        assertEquals(DynamicValue.ofUtf8("row-2"), rows.get(0).get("name"));
        assertEquals(DynamicValue.ofUtf8("row-4"), rows.get(2).get("name"));
        for (RowRecord row : rows) {
            assertFalse(row.contains("id"));
        }
    }

    @Test
    public void testSkipBeyondEndYieldsNothing() throws IOException {
        InMemoryColumnarFile file = new InMemoryColumnarFile("mem", 3, 2);

        List<RowRecord> rows = readAll(file, ReadOptions.builder().skipRows(100).build());

        assertTrue(rows.isEmpty());
        assertEquals(0, file.getRowsRead());
    }

    @Test
    public void testEmptyFile() throws IOException {
        InMemoryColumnarFile file = new InMemoryColumnarFile("mem");

        assertTrue(readAll(file, ReadOptions.all()).isEmpty());
        assertTrue(file.isClosed());
    }

    @Test
    public void testReadAfterExhaustionKeepsReturningNull() throws IOException {
        InMemoryColumnarFile file = new InMemoryColumnarFile("mem", 1);
        try (ColumnarRowReader reader = new ColumnarRowReader(file, ReadOptions.all())) {
            assertNotNull(reader.readRecord());
            assertNull(reader.readRecord());
            assertNull(reader.readRecord());
            assertEquals(1, reader.getRowsEmitted());
        }
    }

    private static List<RowRecord> readAll(InMemoryColumnarFile file, ReadOptions options)
            throws IOException {
        List<RowRecord> rows = new ArrayList<>();
        try (ColumnarRowReader reader = new ColumnarRowReader(file, options)) {
            RowRecord row;
            while ((row = reader.readRecord()) != null) {
                rows.add(row);
            }
        }
        return rows;
    }
}
