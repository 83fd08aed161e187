package com.mini.parquet.session;

import com.google.common.annotations.VisibleForTesting;
import com.mini.parquet.cache.ReaderCache;
import com.mini.parquet.data.RowRecord;
import com.mini.parquet.format.ColumnarFileOpener;
import com.mini.parquet.format.parquet.ParquetColumnarFileOpener;
import com.mini.parquet.reader.ChunkHandler;
import com.mini.parquet.reader.ChunkedReader;
import com.mini.parquet.reader.FullReader;
import com.mini.parquet.reader.ReadOptions;
import com.mini.parquet.schema.FileMetadata;
import com.mini.parquet.schema.MetadataInspector;
import com.mini.parquet.schema.SchemaDescriptor;
import com.mini.parquet.schema.SchemaInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Parquet Session
 * 读取 Parquet 文件的入口，每个逻辑会话一个实例
 *
 * 会话持有一个全量读取结果缓存，所有并发调用方共享；close 时清空缓存。
 * 全量读取的缓存键只有文件路径，命中时不会按本次调用的选项重新过滤。
 */
public class ParquetSession implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ParquetSession.class);

    private final ReaderCache cache;
    private final FullReader fullReader;
    private final ChunkedReader chunkedReader;
    private final SchemaInspector schemaInspector;
    private final MetadataInspector metadataInspector;

    public ParquetSession() {
        this(SessionContext.defaults());
    }

    public ParquetSession(SessionContext context) {
        this(new ReaderCache(context.getCacheTtl()),
                new ParquetColumnarFileOpener(context.toHadoopConfiguration()));
        logger.info("Parquet session opened with {}", context);
    }

    @VisibleForTesting
    ParquetSession(ReaderCache cache, ColumnarFileOpener opener) {
        this.cache = cache;
        this.fullReader = new FullReader(cache, opener);
        this.chunkedReader = new ChunkedReader(opener);
        this.schemaInspector = new SchemaInspector(opener);
        this.metadataInspector = new MetadataInspector(opener);
    }

    /**
     * 读取文件全部行
     */
    public List<RowRecord> read(String path) throws IOException {
        return fullReader.readAll(path, ReadOptions.all());
    }

    public List<RowRecord> read(String path, ReadOptions options) throws IOException {
        return fullReader.readAll(path, options);
    }

    /**
     * 使用弱类型选项读取，支持的键见 {@link ReadOptions#fromMap(Map)}
     */
    public List<RowRecord> read(String path, @Nullable Map<String, ?> options) throws IOException {
        return fullReader.readAll(path, ReadOptions.fromMap(options));
    }

    /**
     * 分块读取完整行，不使用缓存
     */
    public void readChunked(String path, int chunkSize, ChunkHandler onChunk) throws IOException {
        chunkedReader.readChunked(path, chunkSize, onChunk);
    }

    public SchemaDescriptor getSchema(String path) throws IOException {
        return schemaInspector.getSchema(path);
    }

    public FileMetadata getMetadata(String path) throws IOException {
        return metadataInspector.getMetadata(path);
    }

    /**
     * 使某个文件的缓存结果失效
     */
    public void invalidate(String path) {
        cache.remove(path);
    }

    public void setCacheTtl(Duration ttl) {
        cache.setTtl(ttl);
    }

    public ReaderCache cache() {
        return cache;
    }

    /**
     * 清空所有缓存，不会失败
     */
    @Override
    public void close() {
        cache.clear();
        logger.info("Parquet session closed");
    }
}
