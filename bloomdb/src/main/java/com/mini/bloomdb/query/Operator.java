package com.mini.bloomdb.query;

/**
 * 叶子规则的比较操作符
 */
public enum Operator {
    EQ,  // =
    GT,  // >
    GE,  // >=
    LT,  // <
    LE;  // <=
    
    /**
     * 按名称解析操作符，忽略大小写
     * @throws IllegalArgumentException 未知操作符
     */
    public static Operator fromName(String name) {
        for (Operator op : values()) {
            if (op.name().equalsIgnoreCase(name)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + name);
    }
}
