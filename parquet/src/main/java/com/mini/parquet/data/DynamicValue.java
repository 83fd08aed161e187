package com.mini.parquet.data;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Objects;

/**
 * 动态值
 * 行记录中单个列值的封闭类型集合，只能通过本类的静态工厂方法创建
 *
 * 取值种类:
 * NULL, BOOL, INT32, INT64, FLOAT32, FLOAT64, UTF8_STRING, RAW_BYTES, FALLBACK_STRING
 */
public abstract class DynamicValue {

    /**
     * 值的种类
     */
    public enum Kind {
        NULL,
        BOOL,
        INT32,
        INT64,
        FLOAT32,
        FLOAT64,
        UTF8_STRING,
        RAW_BYTES,
        FALLBACK_STRING
    }

    private DynamicValue() {}

    public abstract Kind kind();

    /**
     * 转换为普通 Java 对象，NULL 返回 null
     * 供弱类型调用方（Map 形式的行）以及 JSON 序列化使用
     */
    @JsonValue
    public abstract Object toJavaObject();

    public boolean isNull() {
        return kind() == Kind.NULL;
    }

    public static DynamicValue nullValue() {
        return NullValue.INSTANCE;
    }

    public static DynamicValue ofBool(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    public static DynamicValue ofInt32(int value) {
        return new Int32Value(value);
    }

    public static DynamicValue ofInt64(long value) {
        return new Int64Value(value);
    }

    public static DynamicValue ofFloat32(float value) {
        return new Float32Value(value);
    }

    public static DynamicValue ofFloat64(double value) {
        return new Float64Value(value);
    }

    public static DynamicValue ofUtf8(String value) {
        return new Utf8StringValue(Objects.requireNonNull(value, "value"));
    }

    public static DynamicValue ofRawBytes(byte[] value) {
        return new RawBytesValue(Objects.requireNonNull(value, "value").clone());
    }

    public static DynamicValue ofFallback(String rendering) {
        return new FallbackStringValue(Objects.requireNonNull(rendering, "rendering"));
    }

    public static final class NullValue extends DynamicValue {
        static final NullValue INSTANCE = new NullValue();

        private NullValue() {}

        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public Object toJavaObject() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    public static final class BoolValue extends DynamicValue {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        private final boolean value;

        private BoolValue(boolean value) {
            this.value = value;
        }

        public boolean booleanValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public Object toJavaObject() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class Int32Value extends DynamicValue {
        private final int value;

        private Int32Value(int value) {
            this.value = value;
        }

        public int intValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.INT32;
        }

        @Override
        public Object toJavaObject() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Int32Value && ((Int32Value) o).value == value;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class Int64Value extends DynamicValue {
        private final long value;

        private Int64Value(long value) {
            this.value = value;
        }

        public long longValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.INT64;
        }

        @Override
        public Object toJavaObject() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Int64Value && ((Int64Value) o).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return value + "L";
        }
    }

    public static final class Float32Value extends DynamicValue {
        private final float value;

        private Float32Value(float value) {
            this.value = value;
        }

        public float floatValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.FLOAT32;
        }

        @Override
        public Object toJavaObject() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Float32Value
                    && Float.compare(((Float32Value) o).value, value) == 0;
        }

        @Override
        public int hashCode() {
            return Float.hashCode(value);
        }

        @Override
        public String toString() {
            return value + "f";
        }
    }

    public static final class Float64Value extends DynamicValue {
        private final double value;

        private Float64Value(double value) {
            this.value = value;
        }

        public double doubleValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.FLOAT64;
        }

        @Override
        public Object toJavaObject() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Float64Value
                    && Double.compare(((Float64Value) o).value, value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class Utf8StringValue extends DynamicValue {
        private final String value;

        private Utf8StringValue(String value) {
            this.value = value;
        }

        public String stringValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.UTF8_STRING;
        }

        @Override
        public Object toJavaObject() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Utf8StringValue && ((Utf8StringValue) o).value.equals(value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    /**
     * 定长字节序列，不做解码
     */
    public static final class RawBytesValue extends DynamicValue {
        private final byte[] value;

        private RawBytesValue(byte[] value) {
            this.value = value;
        }

        public byte[] bytes() {
            return value.clone();
        }

        @Override
        public Kind kind() {
            return Kind.RAW_BYTES;
        }

        @Override
        public Object toJavaObject() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RawBytesValue && Arrays.equals(((RawBytesValue) o).value, value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "bytes[" + value.length + "]";
        }
    }

    /**
     * 无法识别的值类型，保存其可读的字符串形式
     */
    public static final class FallbackStringValue extends DynamicValue {
        private final String rendering;

        private FallbackStringValue(String rendering) {
            this.rendering = rendering;
        }

        public String rendering() {
            return rendering;
        }

        @Override
        public Kind kind() {
            return Kind.FALLBACK_STRING;
        }

        @Override
        public Object toJavaObject() {
            return rendering;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FallbackStringValue
                    && ((FallbackStringValue) o).rendering.equals(rendering);
        }

        @Override
        public int hashCode() {
            return rendering.hashCode();
        }

        @Override
        public String toString() {
            return rendering;
        }
    }
}
