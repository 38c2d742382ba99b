package com.mini.bloomdb.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 文件索引
 * 一个源数据文件的全部列索引，是持久化的最小单位
 * 
 * 构建后不可变；重建时整体替换，不做局部更新。
 */
public final class FileIndex {
    
    /** 源数据文件路径 */
    private final String sourcePath;
    
    /** 列名 -> 列索引，保持源文件中的列顺序 */
    private final Map<String, ColumnIndex> columns;
    
    /** 构建失败的列，查询时无法排除 */
    private final Set<String> unindexedColumns;
    
    private final double errorRate;
    private final int rangeFilterThreshold;
    
    /** 构建时间（毫秒） */
    private final long createdAt;
    
    public FileIndex(String sourcePath, 
                     Map<String, ColumnIndex> columns, 
                     Set<String> unindexedColumns,
                     double errorRate,
                     int rangeFilterThreshold,
                     long createdAt) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath is null");
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.unindexedColumns = Collections.unmodifiableSet(new LinkedHashSet<>(unindexedColumns));
        this.errorRate = errorRate;
        this.rangeFilterThreshold = rangeFilterThreshold;
        this.createdAt = createdAt;
        
        for (String column : this.unindexedColumns) {
            if (this.columns.containsKey(column)) {
                throw new IllegalArgumentException(
                    "Column " + column + " cannot be both indexed and unindexed");
            }
        }
    }
    
    public String getSourcePath() {
        return sourcePath;
    }
    
    /**
     * 获取列索引
     * @return 列不存在或构建失败时返回 null
     */
    public ColumnIndex getColumnIndex(String column) {
        return columns.get(column);
    }
    
    public Map<String, ColumnIndex> getColumns() {
        return columns;
    }
    
    public boolean isUnindexed(String column) {
        return unindexedColumns.contains(column);
    }
    
    public Set<String> getUnindexedColumns() {
        return unindexedColumns;
    }
    
    public double getErrorRate() {
        return errorRate;
    }
    
    public int getRangeFilterThreshold() {
        return rangeFilterThreshold;
    }
    
    public long getCreatedAt() {
        return createdAt;
    }
    
    @Override
    public String toString() {
        return "FileIndex{" +
                "sourcePath='" + sourcePath + '\'' +
                ", columns=" + columns.keySet() +
                ", unindexedColumns=" + unindexedColumns +
                '}';
    }
}
