package com.mini.parquet.reader;

import com.google.common.base.Preconditions;
import com.mini.parquet.data.RowRecord;
import com.mini.parquet.format.ColumnarFileOpener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分块读取器
 * 流式读取完整行（不投影），每累积 chunkSize 行回调一次，内存中最多保留一个块
 * 从不读取或写入缓存
 */
public class ChunkedReader {
    private static final Logger logger = LoggerFactory.getLogger(ChunkedReader.class);

    /** 缓冲区初始容量上限 */
    private static final int MAX_INITIAL_CAPACITY = 1024;

    private final ColumnarFileOpener opener;

    public ChunkedReader(ColumnarFileOpener opener) {
        this.opener = Preconditions.checkNotNull(opener, "opener");
    }

    /**
     * 分块读取文件
     *
     * @param path 文件路径
     * @param chunkSize 每块行数，必须为正数
     * @param handler 分块回调
     * @throws IOException 文件访问失败、格式错误，或回调抛出的异常
     */
    public void readChunked(String path, int chunkSize, ChunkHandler handler) throws IOException {
        Preconditions.checkNotNull(path, "path");
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive: %s", chunkSize);
        Preconditions.checkNotNull(handler, "handler");

        int chunks = 0;
        try (ColumnarRowReader reader = new ColumnarRowReader(opener.open(path), ReadOptions.all())) {
            List<RowRecord> buffer = newBuffer(chunkSize);
            RowRecord row;
            while ((row = reader.readRecord()) != null) {
                buffer.add(row);
                if (buffer.size() >= chunkSize) {
                    deliver(handler, buffer, chunks++);
                    buffer = newBuffer(chunkSize);
                }
            }
            if (!buffer.isEmpty()) {
                deliver(handler, buffer, chunks++);
            }
            logger.debug("Chunked read of {} finished: {} rows in {} chunks",
                    path, reader.getRowsEmitted(), chunks);
        }
    }

    private static void deliver(ChunkHandler handler, List<RowRecord> buffer, int chunkIndex)
            throws IOException {
        logger.trace("Delivering chunk {} with {} rows", chunkIndex, buffer.size());
        handler.onChunk(Collections.unmodifiableList(buffer));
    }

    private static List<RowRecord> newBuffer(int chunkSize) {
        return new ArrayList<>(Math.min(chunkSize, MAX_INITIAL_CAPACITY));
    }
}
