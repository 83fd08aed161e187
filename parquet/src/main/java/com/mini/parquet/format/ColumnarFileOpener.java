package com.mini.parquet.format;

import java.io.IOException;

/**
 * 列式文件打开器
 * 负责把文件路径变成 {@link ColumnarFile}，并把失败区分为访问失败和格式错误
 */
@FunctionalInterface
public interface ColumnarFileOpener {

    /**
     * 打开文件
     *
     * @param path 文件路径
     * @return 已打开的文件，调用方负责关闭
     * @throws com.mini.parquet.exception.FileAccessException 文件不存在或不可读
     * @throws com.mini.parquet.exception.FileFormatException 文件不是合法的列式文件
     */
    ColumnarFile open(String path) throws IOException;
}
