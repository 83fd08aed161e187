package com.mini.parquet.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Map;

/**
 * 序列化工具类
 * 提供 JSON 序列化、反序列化以及转换为弱类型 Map 的功能
 */
public class SerializationUtils {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> MAP_TYPE =
            new TypeReference<Map<String, Object>>() {};

    static {
        OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private SerializationUtils() {}

    /**
     * 将对象序列化为JSON字符串
     */
    public static String toJson(Object object) throws IOException {
        return OBJECT_MAPPER.writeValueAsString(object);
    }

    /**
     * 从JSON字符串反序列化对象
     */
    public static <T> T fromJson(String json, Class<T> clazz) throws IOException {
        return OBJECT_MAPPER.readValue(json, clazz);
    }

    /**
     * 将对象转换为由 Map、List 和基本类型组成的结构，键顺序与序列化顺序一致
     */
    public static Map<String, Object> toMap(Object object) {
        return OBJECT_MAPPER.convertValue(object, MAP_TYPE);
    }
}
