package com.mini.bloomdb.schema;

import java.util.Objects;

/**
 * 字段定义类
 * 表示数据文件中的一个列
 */
public class Field {
    /** 字段名 */
    private final String name;
    
    /** 字段类型 */
    private final DataType type;

    public Field(String name, DataType type) {
        this.name = Objects.requireNonNull(name, "Field name cannot be null");
        this.type = Objects.requireNonNull(type, "Field type cannot be null");
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Field field = (Field) o;
        return name.equals(field.name) && type == field.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "Field{" +
                "name='" + name + '\'' +
                ", type=" + type +
                '}';
    }
}
