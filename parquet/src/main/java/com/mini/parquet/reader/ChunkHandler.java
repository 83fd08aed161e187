package com.mini.parquet.reader;

import com.mini.parquet.data.RowRecord;

import java.io.IOException;
import java.util.List;

/**
 * 分块回调
 * 在调用方线程上同步执行，回调阻塞时读取循环也随之阻塞
 * 回调抛出的异常会立即终止读取并原样传播给调用方
 */
@FunctionalInterface
public interface ChunkHandler {

    /**
     * 处理一个数据块
     *
     * @param chunk 不可修改的行列表，调用方可以持有
     * @throws IOException 处理失败，终止读取
     */
    void onChunk(List<RowRecord> chunk) throws IOException;
}
