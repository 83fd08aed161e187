package com.mini.parquet.format;

import com.mini.parquet.reader.RecordReader;

import java.util.List;

/**
 * Row Group Reader
 * 按存储顺序逐行读取一个行组，每行是与顶层字段列表位置对齐的值序列
 * readRecord 在行组读完后返回 null
 */
public interface RowGroupReader extends RecordReader<List<TypedValue>> {

    /**
     * 行组在文件中的序号
     */
    int index();

    /**
     * 行组中的行数
     */
    long rowCount();

    /**
     * 行组中的列块数量
     */
    int columnCount();
}
