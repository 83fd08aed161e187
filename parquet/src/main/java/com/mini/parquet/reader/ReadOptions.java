package com.mini.parquet.reader;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 全量读取选项
 *
 * - columns: 投影列集合，null 或空集合表示读取全部列
 * - rowLimit: 最多返回的行数，0 表示不限制
 * - skipRows: 返回前跳过的行数
 *
 * 数值字段在构建时归一化为非负整数
 */
public final class ReadOptions {

    public static final String COLUMNS = "columns";
    public static final String ROW_LIMIT = "rowLimit";
    public static final String SKIP_ROWS = "skipRows";

    private static final ReadOptions ALL = builder().build();

    @Nullable private final Set<String> columns;
    private final int rowLimit;
    private final int skipRows;

    private ReadOptions(@Nullable Set<String> columns, int rowLimit, int skipRows) {
        this.columns = columns;
        this.rowLimit = rowLimit;
        this.skipRows = skipRows;
    }

    /**
     * 读取全部列、全部行
     */
    public static ReadOptions all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 从弱类型的选项 Map 解析
     * 数值可以是任意 {@link Number}（浮点数截断为整数，超出 int 范围时取边界值），columns 中的非字符串元素被忽略，未知键被忽略
     */
    public static ReadOptions fromMap(@Nullable Map<String, ?> options) {
        if (options == null || options.isEmpty()) {
            return ALL;
        }
        Builder builder = builder();

        Object columns = options.get(COLUMNS);
        if (columns instanceof Collection) {
            builder.columns(stringsOf((Collection<?>) columns));
        } else if (columns instanceof Object[]) {
            builder.columns(stringsOf(Arrays.asList((Object[]) columns)));
        }

        Object rowLimit = options.get(ROW_LIMIT);
        if (rowLimit instanceof Number) {
            builder.rowLimit(Ints.saturatedCast(((Number) rowLimit).longValue()));
        }

        Object skipRows = options.get(SKIP_ROWS);
        if (skipRows instanceof Number) {
            builder.skipRows(Ints.saturatedCast(((Number) skipRows).longValue()));
        }
        return builder.build();
    }

    private static Set<String> stringsOf(Collection<?> values) {
        ImmutableSet.Builder<String> strings = ImmutableSet.builder();
        for (Object value : values) {
            if (value instanceof String) {
                strings.add((String) value);
            }
        }
        return strings.build();
    }

    /**
     * 投影列，null 表示全部列
     */
    @Nullable
    public Set<String> getColumns() {
        return columns;
    }

    public boolean hasProjection() {
        return columns != null && !columns.isEmpty();
    }

    public int getRowLimit() {
        return rowLimit;
    }

    public boolean isLimited() {
        return rowLimit > 0;
    }

    public int getSkipRows() {
        return skipRows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReadOptions)) return false;
        ReadOptions that = (ReadOptions) o;
        return rowLimit == that.rowLimit
                && skipRows == that.skipRows
                && Objects.equals(columns, that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rowLimit, skipRows);
    }

    @Override
    public String toString() {
        return "ReadOptions{" +
                "columns=" + columns +
                ", rowLimit=" + rowLimit +
                ", skipRows=" + skipRows +
                '}';
    }

    /**
     * ReadOptions Builder
     */
    public static class Builder {
        @Nullable private Set<String> columns;
        private int rowLimit = 0;
        private int skipRows = 0;

        public Builder columns(@Nullable Collection<String> columns) {
            this.columns = columns == null ? null : ImmutableSet.copyOf(columns);
            return this;
        }

        public Builder columns(String... columns) {
            return columns(Arrays.asList(columns));
        }

        /**
         * 负数和 0 都表示不限制
         */
        public Builder rowLimit(int rowLimit) {
            this.rowLimit = Math.max(rowLimit, 0);
            return this;
        }

        /**
         * 负数按 0 处理
         */
        public Builder skipRows(int skipRows) {
            this.skipRows = Math.max(skipRows, 0);
            return this;
        }

        public ReadOptions build() {
            return new ReadOptions(columns, rowLimit, skipRows);
        }
    }
}
