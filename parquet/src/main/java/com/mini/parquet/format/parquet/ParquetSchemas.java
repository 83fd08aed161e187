package com.mini.parquet.format.parquet;

import com.mini.parquet.format.ColumnField;
import com.mini.parquet.format.PhysicalKind;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parquet Schema 转换工具
 * 把 Parquet 的 MessageType 顶层字段转换为 {@link ColumnField}
 */
final class ParquetSchemas {

    private ParquetSchemas() {}

    static List<ColumnField> toColumnFields(MessageType schema) {
        List<ColumnField> fields = new ArrayList<>(schema.getFieldCount());
        for (Type type : schema.getFields()) {
            LogicalTypeAnnotation logical = type.getLogicalTypeAnnotation();
            fields.add(new ColumnField(
                    type.getName(),
                    typeName(type),
                    kindOf(type),
                    type.isRepetition(Type.Repetition.OPTIONAL),
                    type.isRepetition(Type.Repetition.REPEATED),
                    logical != null ? logical.toString() : null));
        }
        return Collections.unmodifiableList(fields);
    }

    static String typeName(Type type) {
        if (!type.isPrimitive()) {
            return "GROUP";
        }
        return type.asPrimitiveType().getPrimitiveTypeName().name();
    }

    /**
     * 重复字段和嵌套结构没有单一原始值，统一视为 GROUP
     */
    static PhysicalKind kindOf(Type type) {
        if (!type.isPrimitive() || type.isRepetition(Type.Repetition.REPEATED)) {
            return PhysicalKind.GROUP;
        }
        PrimitiveType.PrimitiveTypeName name = type.asPrimitiveType().getPrimitiveTypeName();
        switch (name) {
            case BOOLEAN:
                return PhysicalKind.BOOLEAN;
            case INT32:
                return PhysicalKind.INT32;
            case INT64:
                return PhysicalKind.INT64;
            case INT96:
                return PhysicalKind.INT96;
            case FLOAT:
                return PhysicalKind.FLOAT;
            case DOUBLE:
                return PhysicalKind.DOUBLE;
            case BINARY:
                return PhysicalKind.BYTE_ARRAY;
            case FIXED_LEN_BYTE_ARRAY:
                return PhysicalKind.FIXED_LEN_BYTE_ARRAY;
            default:
                return PhysicalKind.GROUP;
        }
    }
}
