package com.mini.parquet.format;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * 列式文件的顶层字段描述
 */
public class ColumnField {
    /** 字段名 */
    private final String name;

    /** 存储类型名称，例如 INT64、BINARY、GROUP */
    private final String typeName;

    /** 值的物理类型 */
    private final PhysicalKind kind;

    private final boolean optional;
    private final boolean repeated;

    /** 逻辑类型，例如 STRING、TIMESTAMP(MILLIS,true)，没有时为 null */
    @Nullable private final String logicalType;

    public ColumnField(
            String name,
            String typeName,
            PhysicalKind kind,
            boolean optional,
            boolean repeated,
            @Nullable String logicalType) {
        this.name = Objects.requireNonNull(name, "Field name cannot be null");
        this.typeName = Objects.requireNonNull(typeName, "Field type cannot be null");
        this.kind = Objects.requireNonNull(kind, "Field kind cannot be null");
        this.optional = optional;
        this.repeated = repeated;
        this.logicalType = logicalType;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    public PhysicalKind getKind() {
        return kind;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isRepeated() {
        return repeated;
    }

    @Nullable
    public String getLogicalType() {
        return logicalType;
    }

    @Override
    public String toString() {
        return "ColumnField{" +
                "name='" + name + '\'' +
                ", type=" + typeName +
                ", optional=" + optional +
                ", repeated=" + repeated +
                ", logical=" + logicalType +
                '}';
    }
}
