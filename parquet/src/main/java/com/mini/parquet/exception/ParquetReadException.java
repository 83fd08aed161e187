package com.mini.parquet.exception;

import java.io.IOException;

/**
 * Mini Parquet 读取异常基类
 * 所有文件级读取失败都携带出错的文件路径
 */
public class ParquetReadException extends IOException {
    private static final long serialVersionUID = 1L;

    /** 出错的文件路径 */
    private final String path;

    public ParquetReadException(String path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public ParquetReadException(String path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
