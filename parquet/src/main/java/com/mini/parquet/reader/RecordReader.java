package com.mini.parquet.reader;

import java.io.Closeable;
import java.io.IOException;

/**
 * Record Reader Interface
 * 统一的拉取式记录读取接口
 *
 * 设计理念：
 * 1. 逐条读取，由调用方控制读取节奏
 * 2. 支持资源自动清理
 */
public interface RecordReader<T> extends Closeable {

    /**
     * 读取下一条记录
     *
     * @return 下一条记录，如果没有更多记录返回 null
     * @throws IOException 读取异常
     */
    T readRecord() throws IOException;

    /**
     * 关闭读取器，释放资源
     */
    @Override
    void close() throws IOException;
}
