package com.mini.bloomdb.index;

import com.mini.bloomdb.exception.InvalidColumnException;
import com.mini.bloomdb.schema.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 列索引构建器
 * 
 * 根据列中不同值的个数选择索引类型：
 * 少于阈值使用 {@link MembershipIndex}，达到或超过阈值使用 {@link RangeIndex}。
 */
public class ColumnIndexBuilder {
    
    private static final Logger logger = LoggerFactory.getLogger(ColumnIndexBuilder.class);
    
    private final double errorRate;
    private final int rangeFilterThreshold;
    
    public ColumnIndexBuilder(IndexOptions options) {
        this.errorRate = options.getErrorRate();
        this.rangeFilterThreshold = options.getRangeFilterThreshold();
    }
    
    /**
     * @throws com.mini.bloomdb.exception.ConfigurationException 参数非法
     */
    public ColumnIndexBuilder(double errorRate, int rangeFilterThreshold) {
        this(IndexOptions.builder()
                .errorRate(errorRate)
                .rangeFilterThreshold(rangeFilterThreshold)
                .build());
    }
    
    /**
     * 构建列索引，数据类型由值推断
     * 
     * 空列推断为 STRING；只含整数和浮点数的列推断为 DOUBLE；混合其他类型的列推断为 VARIANT。
     */
    public ColumnIndex build(String column, Collection<?> values) {
        Set<Object> distinct = distinctValues(column, values);
        DataType type = inferType(distinct);
        if (type == DataType.DOUBLE) {
            distinct = widenToDouble(distinct);
        }
        return buildIndex(column, type, distinct);
    }
    
    /**
     * 构建列索引
     * @param column 列名
     * @param type 列的声明类型
     * @param values 列中的全部值，允许重复和 null
     * @throws InvalidColumnException 值与类型不符，或该列需要范围索引但值不可排序
     */
    public ColumnIndex build(String column, DataType type, Collection<?> values) {
        Set<Object> distinct = distinctValues(column, values);
        if (type == DataType.DOUBLE) {
            distinct = widenToDouble(distinct);
        }
        for (Object value : distinct) {
            if (!type.isCompatible(value)) {
                throw new InvalidColumnException(column, 
                    "value " + value + " is not of type " + type);
            }
        }
        return buildIndex(column, type, distinct);
    }
    
    private ColumnIndex buildIndex(String column, DataType type, Set<Object> distinct) {
        if (distinct.size() < rangeFilterThreshold) {
            MembershipIndex index = MembershipIndex.create(column, type, distinct, errorRate);
            logger.debug("Built membership index: column={}, type={}, distinct={}", 
                        column, type, distinct.size());
            return index;
        }
        
        if (!type.isComparable()) {
            throw new InvalidColumnException(column, 
                distinct.size() + " distinct values require a range index but " 
                    + type + " values are not mutually orderable");
        }
        
        Iterator<Object> it = distinct.iterator();
        Comparable<Object> min = asComparable(it.next());
        Comparable<Object> max = min;
        while (it.hasNext()) {
            Comparable<Object> value = asComparable(it.next());
            if (value.compareTo(min) < 0) {
                min = value;
            }
            if (value.compareTo(max) > 0) {
                max = value;
            }
        }
        
        logger.debug("Built range index: column={}, type={}, distinct={}, min={}, max={}", 
                    column, type, distinct.size(), min, max);
        return new RangeIndex(column, type, min, max);
    }
    
    /**
     * 去掉 null、规范化并去重，保持首次出现的顺序
     */
    private Set<Object> distinctValues(String column, Collection<?> values) {
        Set<Object> distinct = new LinkedHashSet<>();
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            try {
                distinct.add(DataType.normalize(value));
            } catch (IllegalArgumentException e) {
                throw new InvalidColumnException(column, e.getMessage(), e);
            }
        }
        return distinct;
    }
    
    private static DataType inferType(Set<Object> distinct) {
        DataType type = null;
        for (Object value : distinct) {
            DataType current = DataType.typeOf(value);
            if (type == null || type == current) {
                type = current;
            } else if (isNumeric(type) && isNumeric(current)) {
                type = DataType.DOUBLE;
            } else {
                return DataType.VARIANT;
            }
        }
        return type == null ? DataType.STRING : type;
    }
    
    private static boolean isNumeric(DataType type) {
        return type == DataType.BIGINT || type == DataType.DOUBLE;
    }
    
    /**
     * 整数转为浮点数后重新去重，1 和 1.0 合并为同一个值
     */
    private static Set<Object> widenToDouble(Set<Object> distinct) {
        Set<Object> widened = new LinkedHashSet<>();
        for (Object value : distinct) {
            widened.add(value instanceof Long ? DataType.normalize(((Long) value).doubleValue()) : value);
        }
        return widened;
    }
    
    @SuppressWarnings("unchecked")
    private static Comparable<Object> asComparable(Object value) {
        return (Comparable<Object>) value;
    }
    
    public double getErrorRate() {
        return errorRate;
    }
    
    public int getRangeFilterThreshold() {
        return rangeFilterThreshold;
    }
}
