package com.mini.bloomdb.index;

import com.mini.bloomdb.schema.DataType;

import java.util.Objects;
import java.util.Optional;

/**
 * 范围索引
 * 存储列的最小值和最大值，判断查询值是否落在 [min, max] 内
 * 
 * 范围外的值一定不存在；范围内的值可能从未出现过。
 */
public final class RangeIndex implements ColumnIndex {
    
    private final String column;
    private final DataType dataType;
    
    /** 最小值 */
    @SuppressWarnings("rawtypes")
    private final Comparable minValue;
    
    /** 最大值 */
    @SuppressWarnings("rawtypes")
    private final Comparable maxValue;
    
    @SuppressWarnings("rawtypes")
    RangeIndex(String column, DataType dataType, Comparable minValue, Comparable maxValue) {
        this.column = Objects.requireNonNull(column, "column is null");
        this.dataType = Objects.requireNonNull(dataType, "dataType is null");
        this.minValue = Objects.requireNonNull(minValue, "minValue is null");
        this.maxValue = Objects.requireNonNull(maxValue, "maxValue is null");
    }
    
    @Override
    public IndexType getIndexType() {
        return IndexType.RANGE;
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
        Optional<Comparable<Object>> target = toComparable(value);
        if (!target.isPresent()) {
            return false;
        }
        Comparable<Object> v = target.get();
        return v.compareTo(minValue) >= 0 && v.compareTo(maxValue) <= 0;
    }
    
    /**
     * 是否可能存在大于（或等于）给定值的元素
     */
    public boolean mightContainGreater(Object value, boolean inclusive) {
        Optional<Comparable<Object>> target = toComparable(value);
        if (!target.isPresent()) {
            return false;
        }
        int cmp = target.get().compareTo(maxValue);
        return inclusive ? cmp <= 0 : cmp < 0;
    }
    
    /**
     * 是否可能存在小于（或等于）给定值的元素
     */
    public boolean mightContainLess(Object value, boolean inclusive) {
        Optional<Comparable<Object>> target = toComparable(value);
        if (!target.isPresent()) {
            return false;
        }
        int cmp = target.get().compareTo(minValue);
        return inclusive ? cmp >= 0 : cmp > 0;
    }
    
    @Override
    public boolean isEmpty() {
        return false;
    }
    
    @SuppressWarnings("unchecked")
    private Optional<Comparable<Object>> toComparable(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        return dataType.coerce(value).map(v -> (Comparable<Object>) v);
    }
    
    public Object getMinValue() {
        return minValue;
    }
    
    public Object getMaxValue() {
        return maxValue;
    }
    
    @Override
    public String toString() {
        return "RangeIndex{" +
                "column='" + column + '\'' +
                ", dataType=" + dataType +
                ", minValue=" + minValue +
                ", maxValue=" + maxValue +
                '}';
    }
}
