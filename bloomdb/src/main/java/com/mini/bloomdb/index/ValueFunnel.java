package com.mini.bloomdb.index;

import com.google.common.hash.Funnel;
import com.google.common.hash.PrimitiveSink;

import java.nio.charset.StandardCharsets;

/**
 * 规范值到布隆过滤器的哈希输入
 * 先写入类型标记，保证 1L 和 "1" 互不冲突
 * 整数值的 Double 按 Long 哈希，混合类型列中 1L 和 1.0 视为同一个值
 */
enum ValueFunnel implements Funnel<Object> {
    INSTANCE;
    
    private static final byte TAG_LONG = 1;
    private static final byte TAG_DOUBLE = 2;
    private static final byte TAG_BOOLEAN = 3;
    private static final byte TAG_STRING = 4;
    
    @Override
    public void funnel(Object value, PrimitiveSink into) {
        if (value instanceof Long) {
            into.putByte(TAG_LONG).putLong((Long) value);
        } else if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63) {
                into.putByte(TAG_LONG).putLong((long) d);
            } else {
                into.putByte(TAG_DOUBLE).putDouble(d);
            }
        } else if (value instanceof Boolean) {
            into.putByte(TAG_BOOLEAN).putBoolean((Boolean) value);
        } else if (value instanceof String) {
            into.putByte(TAG_STRING).putString((String) value, StandardCharsets.UTF_8);
        } else {
            throw new IllegalArgumentException("Not a normalized value: " + value);
        }
    }
}
