package com.mini.bloomdb.index;

import com.google.common.hash.BloomFilter;
import com.mini.bloomdb.schema.DataType;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * 成员索引
 * 使用 Guava BloomFilter 保存列中所有不同的值
 * 
 * 不存在假阴性；假阳性概率由构建时的误判率决定。
 */
public final class MembershipIndex implements ColumnIndex {
    
    private final String column;
    private final DataType dataType;
    private final BloomFilter<Object> filter;
    
    /** 插入的不同值个数 */
    private final int elementCount;
    
    private MembershipIndex(String column, DataType dataType, BloomFilter<Object> filter, int elementCount) {
        this.column = Objects.requireNonNull(column, "column is null");
        this.dataType = Objects.requireNonNull(dataType, "dataType is null");
        this.filter = Objects.requireNonNull(filter, "filter is null");
        this.elementCount = elementCount;
    }
    
    /**
     * 根据不同值集合构建成员索引
     * @param distinctValues 已规范化且去重的值
     * @param fpp 目标误判率
     */
    static MembershipIndex create(String column, DataType dataType, 
                                  Collection<Object> distinctValues, double fpp) {
        BloomFilter<Object> filter = BloomFilter.create(
                ValueFunnel.INSTANCE, distinctValues.size(), fpp);
        for (Object value : distinctValues) {
            filter.put(value);
        }
        return new MembershipIndex(column, dataType, filter, distinctValues.size());
    }
    
    /**
     * 从序列化数据恢复
     */
    static MembershipIndex readFrom(String column, DataType dataType, 
                                    int elementCount, InputStream in) throws IOException {
        BloomFilter<Object> filter = BloomFilter.readFrom(in, ValueFunnel.INSTANCE);
        return new MembershipIndex(column, dataType, filter, elementCount);
    }
    
    void writeTo(OutputStream out) throws IOException {
        filter.writeTo(out);
    }
    
    @Override
    public IndexType getIndexType() {
        return IndexType.MEMBERSHIP;
    }
    
    @Override
    public String getColumn() {
        return column;
    }
    
    @Override
    public DataType getDataType() {
        return dataType;
    }
    
    @Override
    public boolean contains(Object value) {
        if (value == null || elementCount == 0) {
            return false;
        }
        Optional<Object> target = dataType.coerce(value);
        return target.isPresent() && filter.mightContain(target.get());
    }
    
    @Override
    public boolean isEmpty() {
        return elementCount == 0;
    }
    
    public int getElementCount() {
        return elementCount;
    }
    
    /**
     * 按当前插入量估算的误判率
     */
    public double expectedFpp() {
        return filter.expectedFpp();
    }
    
    @Override
    public String toString() {
        return "MembershipIndex{" +
                "column='" + column + '\'' +
                ", dataType=" + dataType +
                ", elementCount=" + elementCount +
                '}';
    }
}
