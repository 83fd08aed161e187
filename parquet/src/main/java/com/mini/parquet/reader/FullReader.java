package com.mini.parquet.reader;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.mini.parquet.cache.ReaderCache;
import com.mini.parquet.data.RowRecord;
import com.mini.parquet.format.ColumnarFileOpener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 全量读取器
 * 读取整个文件并缓存结果
 *
 * 缓存键只有文件路径：命中时直接返回缓存的结果，不会重新应用本次调用的选项。
 * 因此同一路径在缓存有效期内的后续读取，总是得到第一次读取时按当时选项过滤后的快照。
 */
public class FullReader {
    private static final Logger logger = LoggerFactory.getLogger(FullReader.class);

    private final ReaderCache cache;
    private final ColumnarFileOpener opener;

    public FullReader(ReaderCache cache, ColumnarFileOpener opener) {
        this.cache = Preconditions.checkNotNull(cache, "cache");
        this.opener = Preconditions.checkNotNull(opener, "opener");
    }

    public List<RowRecord> readAll(String path) throws IOException {
        return readAll(path, ReadOptions.all());
    }

    /**
     * 读取文件中的行
     *
     * @param path 文件路径
     * @param options 读取选项，仅在缓存未命中时生效
     * @return 不可修改的行列表
     * @throws IOException 文件访问失败或格式错误
     */
    public List<RowRecord> readAll(String path, ReadOptions options) throws IOException {
        Preconditions.checkNotNull(path, "path");
        Preconditions.checkNotNull(options, "options");

        List<RowRecord> cached = cache.get(path);
        if (cached != null) {
            logger.debug("Read cache hit: {} ({} rows)", path, cached.size());
            return cached;
        }

        logger.debug("Read cache miss: {}, reading with {}", path, options);
        List<RowRecord> rows = new ArrayList<>();
        try (ColumnarRowReader reader = new ColumnarRowReader(opener.open(path), options)) {
            RowRecord row;
            while ((row = reader.readRecord()) != null) {
                rows.add(row);
            }
            logger.debug("Read {} rows from {} ({} rows scanned)",
                    rows.size(), path, reader.getRowsEncountered());
        }

        List<RowRecord> result = ImmutableList.copyOf(rows);
        cache.set(path, result);
        return result;
    }
}
