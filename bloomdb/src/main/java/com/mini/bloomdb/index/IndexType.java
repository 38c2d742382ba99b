package com.mini.bloomdb.index;

/**
 * 索引类型枚举
 * 每一列在构建时只会选择其中一种
 */
public enum IndexType {
    /** 布隆过滤器索引 - 用于低基数列的成员判断 */
    MEMBERSHIP((byte) 0),
    
    /** 最小最大值索引 - 用于高基数列的范围判断 */
    RANGE((byte) 1);
    
    private final byte code;
    
    IndexType(byte code) {
        this.code = code;
    }
    
    /**
     * 序列化格式中的类型标记
     */
    public byte getCode() {
        return code;
    }
    
    public static IndexType fromCode(byte code) {
        for (IndexType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown index type code: " + code);
    }
}
