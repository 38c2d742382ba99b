package com.mini.bloomdb.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * 序列化工具类
 * 提供JSON序列化和反序列化功能
 */
public class SerializationUtils {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        // 网络协议使用紧凑输出
        OBJECT_MAPPER.disable(SerializationFeature.INDENT_OUTPUT);
        OBJECT_MAPPER.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * 将JSON字符串解析为树
     */
    public static JsonNode readTree(String json) throws JsonProcessingException {
        return OBJECT_MAPPER.readTree(json);
    }

    /**
     * 将字节数组解析为树
     */
    public static JsonNode readTree(byte[] bytes) throws IOException {
        return OBJECT_MAPPER.readTree(bytes);
    }

    /**
     * 将对象序列化为字节数组
     */
    public static byte[] toBytes(Object object) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsBytes(object);
    }
}
