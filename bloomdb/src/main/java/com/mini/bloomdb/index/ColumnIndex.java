package com.mini.bloomdb.index;

import com.mini.bloomdb.schema.DataType;

/**
 * 列索引接口
 * 
 * 只有两种实现：{@link MembershipIndex} 和 {@link RangeIndex}。
 * 构建完成后不可变，可以被多个线程并发读取。
 */
public interface ColumnIndex {
    
    /**
     * 获取索引类型
     */
    IndexType getIndexType();
    
    /**
     * 获取索引所属的列名
     */
    String getColumn();
    
    /**
     * 获取列的数据类型，查询值会先转换为该类型再判断
     */
    DataType getDataType();
    
    /**
     * 测试给定值是否可能存在于该列中
     * @param value 查询值（未规范化）
     * @return true 表示可能存在，false 表示一定不存在
     */
    boolean contains(Object value);
    
    /**
     * 索引是否为空（构建时没有任何非空值）
     */
    boolean isEmpty();
}
