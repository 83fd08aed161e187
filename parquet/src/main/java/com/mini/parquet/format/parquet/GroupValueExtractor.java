package com.mini.parquet.format.parquet;

import com.google.common.base.Joiner;
import com.mini.parquet.format.PhysicalKind;
import com.mini.parquet.format.TypedValue;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 Parquet 示例 Group 记录拆成与顶层字段位置对齐的 {@link TypedValue} 序列
 */
final class GroupValueExtractor {

    private static final Joiner LIST_JOINER = Joiner.on(", ");

    private final MessageType schema;
    private final PhysicalKind[] kinds;

    GroupValueExtractor(MessageType schema) {
        this.schema = schema;
        this.kinds = new PhysicalKind[schema.getFieldCount()];
        for (int i = 0; i < kinds.length; i++) {
            kinds[i] = ParquetSchemas.kindOf(schema.getType(i));
        }
    }

    List<TypedValue> extract(Group group) {
        List<TypedValue> values = new ArrayList<>(kinds.length);
        for (int i = 0; i < kinds.length; i++) {
            int repetitions = group.getFieldRepetitionCount(i);
            if (repetitions == 0) {
                values.add(TypedValue.nullOf(kinds[i]));
            } else if (kinds[i] == PhysicalKind.GROUP) {
                values.add(TypedValue.of(PhysicalKind.GROUP, render(group, i, repetitions)));
            } else {
                values.add(TypedValue.of(kinds[i], primitive(group, i, kinds[i])));
            }
        }
        return values;
    }

    private static Object primitive(Group group, int field, PhysicalKind kind) {
        switch (kind) {
            case BOOLEAN:
                return group.getBoolean(field, 0);
            case INT32:
                return group.getInteger(field, 0);
            case INT64:
                return group.getLong(field, 0);
            case INT96:
                return group.getInt96(field, 0).getBytes();
            case FLOAT:
                return group.getFloat(field, 0);
            case DOUBLE:
                return group.getDouble(field, 0);
            case BYTE_ARRAY:
            case FIXED_LEN_BYTE_ARRAY:
                return group.getBinary(field, 0).getBytes();
            default:
                throw new IllegalStateException("Not a primitive kind: " + kind);
        }
    }

    /**
     * 嵌套结构和重复字段渲染为可读字符串，重复字段用 [a, b] 表示
     */
    private String render(Group group, int field, int repetitions) {
        boolean nested = !schema.getType(field).isPrimitive();
        List<String> items = new ArrayList<>(repetitions);
        for (int r = 0; r < repetitions; r++) {
            items.add(nested
                    ? group.getGroup(field, r).toString().trim()
                    : group.getValueToString(field, r));
        }
        if (!schema.getType(field).isRepetition(Type.Repetition.REPEATED)) {
            return items.get(0);
        }
        return "[" + LIST_JOINER.join(items) + "]";
    }
}
