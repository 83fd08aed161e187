package com.mini.parquet.format.parquet;

import com.google.common.base.Throwables;
import com.mini.parquet.exception.FileAccessException;
import com.mini.parquet.exception.FileFormatException;
import com.mini.parquet.exception.ParquetReadException;
import com.mini.parquet.format.ColumnField;
import com.mini.parquet.format.ColumnarFile;
import com.mini.parquet.format.RowGroupReader;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.util.List;

/**
 * 基于 parquet-hadoop {@link ParquetFileReader} 的列式文件实现
 * 行组按存储顺序依次读取，每行通过示例 Group 模型解码
 */
public class ParquetColumnarFile implements ColumnarFile {
    private static final Logger logger = LoggerFactory.getLogger(ParquetColumnarFile.class);

    private final String path;
    private final long byteSize;
    private final ParquetFileReader reader;
    private final MessageType schema;
    private final List<ColumnField> fields;
    private final List<BlockMetaData> blocks;
    private final MessageColumnIO columnIO;
    private final GroupValueExtractor extractor;

    /** 下一个待读取行组的序号 */
    private int nextIndex = 0;

    ParquetColumnarFile(String path, long byteSize, ParquetFileReader reader) {
        this.path = path;
        this.byteSize = byteSize;
        this.reader = reader;
        this.schema = reader.getFooter().getFileMetaData().getSchema();
        this.fields = ParquetSchemas.toColumnFields(schema);
        this.blocks = reader.getRowGroups();
        this.columnIO = new ColumnIOFactory().getColumnIO(schema);
        this.extractor = new GroupValueExtractor(schema);
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public long byteSize() {
        return byteSize;
    }

    @Override
    public List<ColumnField> fields() {
        return fields;
    }

    @Override
    public long numRows() {
        return reader.getRecordCount();
    }

    @Override
    public int numRowGroups() {
        return blocks.size();
    }

    @Override
    public long rowGroupRowCount(int index) {
        return blocks.get(index).getRowCount();
    }

    @Override
    public int rowGroupColumnCount(int index) {
        return blocks.get(index).getColumns().size();
    }

    @Override
    public RowGroupReader nextRowGroup() throws IOException {
        if (nextIndex >= blocks.size()) {
            return null;
        }
        int index = nextIndex++;
        try {
            PageReadStore pages = reader.readNextRowGroup();
            if (pages == null) {
                return null;
            }
            RecordReader<Group> recordReader =
                    columnIO.getRecordReader(pages, new GroupRecordConverter(schema));
            logger.trace("Opened row group {} of {} ({} rows)", index, path, pages.getRowCount());
            return new ParquetRowGroupReader(
                    path, index, pages.getRowCount(), rowGroupColumnCount(index), recordReader, extractor);
        } catch (IOException e) {
            throw classifyReadFailure(path, index, e);
        } catch (RuntimeException e) {
            throw new FileFormatException(path, "Failed to decode row group " + index, e);
        }
    }

    /**
     * 区分行组读取失败的原因
     * 页头或页数据无法解析（异常链中出现非 IO 异常，或数据提前结束）属于格式错误，其余 IO 失败属于访问错误
     */
    static ParquetReadException classifyReadFailure(String path, int index, IOException e) {
        for (Throwable cause : Throwables.getCausalChain(e)) {
            if (cause instanceof EOFException || !(cause instanceof IOException)) {
                return new FileFormatException(path, "Malformed data in row group " + index, e);
            }
        }
        return new FileAccessException(path, "Failed to read row group " + index, e);
    }

    @Override
    public boolean skipNextRowGroup() throws IOException {
        if (nextIndex >= blocks.size()) {
            return false;
        }
        boolean skipped = reader.skipNextRowGroup();
        if (skipped) {
            logger.trace("Skipped row group {} of {}", nextIndex, path);
            nextIndex++;
        }
        return skipped;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
