package com.mini.parquet.reader;

import com.google.common.io.BaseEncoding;
import com.mini.parquet.data.DynamicValue;
import com.mini.parquet.format.TypedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * 值转换器
 * 把列式文件产出的 {@link TypedValue} 转换为 {@link DynamicValue}
 *
 * 转换是全函数：任何输入都有确定的输出，无法识别的类型退化为 FALLBACK_STRING，从不抛异常
 */
public final class ValueConverter {
    private static final Logger logger = LoggerFactory.getLogger(ValueConverter.class);

    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private ValueConverter() {}

    public static DynamicValue convert(TypedValue value) {
        if (value == null || value.isNull()) {
            return DynamicValue.nullValue();
        }
        Object payload = value.payload();
        switch (value.kind()) {
            case BOOLEAN:
                if (payload instanceof Boolean) {
                    return DynamicValue.ofBool((Boolean) payload);
                }
                break;
            case INT32:
                if (payload instanceof Integer) {
                    return DynamicValue.ofInt32((Integer) payload);
                }
                break;
            case INT64:
                if (payload instanceof Long) {
                    return DynamicValue.ofInt64((Long) payload);
                }
                break;
            case INT96:
                if (payload instanceof byte[] && ((byte[]) payload).length >= Long.BYTES) {
                    return DynamicValue.ofInt64(int96ToLong((byte[]) payload));
                }
                break;
            case FLOAT:
                if (payload instanceof Float) {
                    return DynamicValue.ofFloat32((Float) payload);
                }
                break;
            case DOUBLE:
                if (payload instanceof Double) {
                    return DynamicValue.ofFloat64((Double) payload);
                }
                break;
            case BYTE_ARRAY:
                if (payload instanceof byte[]) {
                    return DynamicValue.ofUtf8(new String((byte[]) payload, StandardCharsets.UTF_8));
                }
                break;
            case FIXED_LEN_BYTE_ARRAY:
                if (payload instanceof byte[]) {
                    return DynamicValue.ofRawBytes((byte[]) payload);
                }
                break;
            default:
                return DynamicValue.ofFallback(render(payload));
        }

        logger.warn("Payload {} does not match kind {}, rendering as string",
                payload == null ? null : payload.getClass().getName(), value.kind());
        return DynamicValue.ofFallback(render(payload));
    }

    /**
     * 字节数组渲染为小写十六进制，其余对象使用 toString
     */
    static String render(Object payload) {
        if (payload instanceof byte[]) {
            return HEX.encode((byte[]) payload);
        }
        return String.valueOf(payload);
    }

    /**
     * INT96 收窄为 64 位整数：取 12 字节小端表示中的低 8 字节
     */
    static long int96ToLong(byte[] bytes) {
        return ByteBuffer.wrap(bytes, 0, Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).getLong();
    }
}
