package com.mini.parquet.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mini.parquet.format.ColumnField;

import java.util.Objects;

/**
 * 字段描述
 * 表示文件 Schema 中的一个顶层字段
 */
public class FieldDescriptor {
    /** 没有逻辑类型时的取值 */
    public static final String NO_LOGICAL_TYPE = "none";

    /** 字段名 */
    private final String name;

    /** 存储类型名称 */
    private final String typeName;

    private final boolean optional;
    private final boolean repeated;

    /** 逻辑类型名称，没有时为 "none" */
    private final String logicalType;

    @JsonCreator
    public FieldDescriptor(
            @JsonProperty("name") String name,
            @JsonProperty("type") String typeName,
            @JsonProperty("optional") boolean optional,
            @JsonProperty("repeated") boolean repeated,
            @JsonProperty("logical") String logicalType) {
        this.name = Objects.requireNonNull(name, "Field name cannot be null");
        this.typeName = Objects.requireNonNull(typeName, "Field type cannot be null");
        this.optional = optional;
        this.repeated = repeated;
        this.logicalType = logicalType != null ? logicalType : NO_LOGICAL_TYPE;
    }

    public static FieldDescriptor of(ColumnField field) {
        return new FieldDescriptor(
                field.getName(),
                field.getTypeName(),
                field.isOptional(),
                field.isRepeated(),
                field.getLogicalType());
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public String getTypeName() {
        return typeName;
    }

    @JsonProperty("optional")
    public boolean isOptional() {
        return optional;
    }

    @JsonProperty("repeated")
    public boolean isRepeated() {
        return repeated;
    }

    @JsonProperty("logical")
    public String getLogicalType() {
        return logicalType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldDescriptor that = (FieldDescriptor) o;
        return optional == that.optional &&
                repeated == that.repeated &&
                name.equals(that.name) &&
                typeName.equals(that.typeName) &&
                logicalType.equals(that.logicalType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeName, optional, repeated, logicalType);
    }

    @Override
    public String toString() {
        return "FieldDescriptor{" +
                "name='" + name + '\'' +
                ", type=" + typeName +
                ", optional=" + optional +
                ", repeated=" + repeated +
                ", logical=" + logicalType +
                '}';
    }
}
