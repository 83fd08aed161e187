package com.mini.parquet.exception;

/**
 * 文件格式异常
 * 文件内容不是合法的 Parquet 文件（例如 footer 损坏、magic number 不匹配）
 */
public class FileFormatException extends ParquetReadException {
    private static final long serialVersionUID = 1L;

    public FileFormatException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
