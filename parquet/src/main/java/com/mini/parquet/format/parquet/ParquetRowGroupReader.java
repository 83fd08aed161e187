package com.mini.parquet.format.parquet;

import com.mini.parquet.exception.FileFormatException;
import com.mini.parquet.format.RowGroupReader;
import com.mini.parquet.format.TypedValue;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.io.RecordReader;

import java.io.IOException;
import java.util.List;

/**
 * 基于 parquet-column RecordReader 的行组读取器
 */
class ParquetRowGroupReader implements RowGroupReader {

    private final String path;
    private final int index;
    private final long rowCount;
    private final int columnCount;
    private final RecordReader<Group> recordReader;
    private final GroupValueExtractor extractor;

    private long rowsRead = 0;

    ParquetRowGroupReader(
            String path,
            int index,
            long rowCount,
            int columnCount,
            RecordReader<Group> recordReader,
            GroupValueExtractor extractor) {
        this.path = path;
        this.index = index;
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.recordReader = recordReader;
        this.extractor = extractor;
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public long rowCount() {
        return rowCount;
    }

    @Override
    public int columnCount() {
        return columnCount;
    }

    @Override
    public List<TypedValue> readRecord() throws IOException {
        if (rowsRead >= rowCount) {
            return null;
        }
        try {
            Group group = recordReader.read();
            rowsRead++;
            return extractor.extract(group);
        } catch (RuntimeException e) {
            throw new FileFormatException(path,
                    "Failed to decode row " + rowsRead + " of row group " + index, e);
        }
    }

    @Override
    public void close() {
        // 页数据归属于文件读取器，由 ParquetColumnarFile 统一释放
    }
}
