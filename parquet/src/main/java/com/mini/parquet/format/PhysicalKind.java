package com.mini.parquet.format;

/**
 * 列式文件中值的物理类型标签
 */
public enum PhysicalKind {
    BOOLEAN,
    INT32,
    INT64,
    /** 96 位整数，通常是旧版时间戳编码 */
    INT96,
    FLOAT,
    DOUBLE,
    BYTE_ARRAY,
    FIXED_LEN_BYTE_ARRAY,
    /** 嵌套结构或重复字段，没有单一的原始值 */
    GROUP
}
