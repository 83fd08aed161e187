package com.mini.parquet.data;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 行记录
 * 列名到 {@link DynamicValue} 的有序映射，顺序与文件 Schema 中的字段顺序一致
 * 构建完成后不可变，可以安全地放入缓存并在多个调用方之间共享
 */
public final class RowRecord {

    private final ImmutableMap<String, DynamicValue> values;

    private RowRecord(ImmutableMap<String, DynamicValue> values) {
        this.values = values;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 获取列值，列不存在时返回 null
     */
    @Nullable
    public DynamicValue get(String column) {
        return values.get(column);
    }

    public boolean contains(String column) {
        return values.containsKey(column);
    }

    /**
     * 列名集合，按 Schema 顺序迭代
     */
    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, DynamicValue> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /**
     * 转换为普通 Java 对象的 Map
     * NULL 值以 null 表示
     */
    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, DynamicValue> entry : values.entrySet()) {
            result.put(entry.getKey(), entry.getValue().toJavaObject());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RowRecord)) return false;
        return values.equals(((RowRecord) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RowRecord" + values;
    }

    /**
     * RowRecord Builder
     * 按插入顺序保存列，同名列只允许出现一次
     */
    public static final class Builder {
        private final ImmutableMap.Builder<String, DynamicValue> values = ImmutableMap.builder();

        private Builder() {}

        public Builder put(String column, DynamicValue value) {
            values.put(column, value);
            return this;
        }

        public RowRecord build() {
            return new RowRecord(values.buildOrThrow());
        }
    }
}
