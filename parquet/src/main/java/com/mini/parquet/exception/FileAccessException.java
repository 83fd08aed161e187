package com.mini.parquet.exception;

/**
 * 文件访问异常
 * 文件不存在、不可读或无法获取文件状态时抛出，不会重试
 */
public class FileAccessException extends ParquetReadException {
    private static final long serialVersionUID = 1L;

    public FileAccessException(String path, String message) {
        super(path, message);
    }

    public FileAccessException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }

    /**
     * 文件不存在
     */
    public static FileAccessException notFound(String path) {
        return new FileAccessException(path, "File does not exist");
    }
}
