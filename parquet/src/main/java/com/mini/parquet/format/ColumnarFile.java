package com.mini.parquet.format;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * 已打开的列式文件
 * 持有唯一的文件句柄，直到 close 被调用
 *
 * 行组只能按存储顺序依次访问：nextRowGroup 读取下一个行组，skipNextRowGroup 跳过下一个行组而不解码
 */
public interface ColumnarFile extends Closeable {

    /**
     * 文件路径
     */
    String path();

    /**
     * 文件字节数
     */
    long byteSize();

    /**
     * 顶层字段列表，按 Schema 顺序
     */
    List<ColumnField> fields();

    /**
     * 文件总行数
     */
    long numRows();

    /**
     * 行组数量
     */
    int numRowGroups();

    /**
     * 指定行组的行数（来自文件元数据，不读取数据）
     */
    long rowGroupRowCount(int index);

    /**
     * 指定行组的列块数量
     */
    int rowGroupColumnCount(int index);

    /**
     * 读取下一个行组
     *
     * @return 行组读取器，没有更多行组时返回 null
     * @throws IOException 读取或解码失败
     */
    RowGroupReader nextRowGroup() throws IOException;

    /**
     * 跳过下一个行组
     *
     * @return 是否有行组被跳过
     */
    boolean skipNextRowGroup() throws IOException;
}
