package com.mini.parquet.format;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * 带类型标签的列值
 * 由列式文件读取器产出，payload 的 Java 类型取决于 kind:
 * BOOLEAN -> Boolean, INT32 -> Integer, INT64 -> Long, FLOAT -> Float, DOUBLE -> Double,
 * BYTE_ARRAY / FIXED_LEN_BYTE_ARRAY / INT96 -> byte[], GROUP -> 任意对象（使用 toString 展示）
 */
public final class TypedValue {

    private final PhysicalKind kind;
    private final boolean isNull;
    @Nullable private final Object payload;

    private TypedValue(PhysicalKind kind, boolean isNull, @Nullable Object payload) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.isNull = isNull;
        this.payload = payload;
    }

    public static TypedValue of(PhysicalKind kind, Object payload) {
        return new TypedValue(kind, false, Objects.requireNonNull(payload, "payload"));
    }

    public static TypedValue nullOf(PhysicalKind kind) {
        return new TypedValue(kind, true, null);
    }

    public PhysicalKind kind() {
        return kind;
    }

    public boolean isNull() {
        return isNull;
    }

    @Nullable
    public Object payload() {
        return payload;
    }

    @Override
    public String toString() {
        return isNull ? kind + "(null)" : kind + "(" + payload + ")";
    }
}
