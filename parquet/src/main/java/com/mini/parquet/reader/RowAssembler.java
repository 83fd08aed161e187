package com.mini.parquet.reader;

import com.mini.parquet.data.RowRecord;
import com.mini.parquet.format.ColumnField;
import com.mini.parquet.format.TypedValue;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Set;

/**
 * 行组装器
 * 按 Schema 顺序把位置对齐的值序列组装为 {@link RowRecord}
 *
 * 规则：
 * 1. 投影为 null 或空集合时包含全部列
 * 2. 结果的列顺序总是 Schema 顺序，与投影中的顺序无关
 * 3. 某个位置没有值（序列过短或元素为 null）时省略该列，而不是写入 NULL
 */
public class RowAssembler {

    private final List<ColumnField> fields;

    /** 每个 Schema 位置是否包含在结果中 */
    private final boolean[] included;

    public RowAssembler(List<ColumnField> fields, @Nullable Set<String> projection) {
        this.fields = fields;
        this.included = new boolean[fields.size()];
        boolean all = projection == null || projection.isEmpty();
        for (int i = 0; i < fields.size(); i++) {
            included[i] = all || projection.contains(fields.get(i).getName());
        }
    }

    public RowRecord assemble(List<TypedValue> values) {
        RowRecord.Builder builder = RowRecord.builder();
        for (int i = 0; i < fields.size(); i++) {
            if (!included[i] || i >= values.size()) {
                continue;
            }
            TypedValue value = values.get(i);
            if (value != null) {
                builder.put(fields.get(i).getName(), ValueConverter.convert(value));
            }
        }
        return builder.build();
    }

    public static RowRecord assemble(
            List<ColumnField> fields, List<TypedValue> values, @Nullable Set<String> projection) {
        return new RowAssembler(fields, projection).assemble(values);
    }
}
