package com.mini.bloomdb.index;

import com.mini.bloomdb.exception.InvalidColumnException;
import com.mini.bloomdb.schema.Field;
import com.mini.bloomdb.source.TabularSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 文件索引构建器
 * 为源文件的每一列独立构建列索引
 * 
 * 单列失败不会影响其他列，失败的列记录为未索引列。
 */
public class FileIndexBuilder {
    
    private static final Logger logger = LoggerFactory.getLogger(FileIndexBuilder.class);
    
    private final ColumnIndexBuilder columnIndexBuilder;
    
    public FileIndexBuilder(IndexOptions options) {
        this(new ColumnIndexBuilder(options));
    }
    
    public FileIndexBuilder(ColumnIndexBuilder columnIndexBuilder) {
        this.columnIndexBuilder = columnIndexBuilder;
    }
    
    /**
     * 为数据源构建文件索引
     * @throws com.mini.bloomdb.exception.DataSourceException 数据源读取失败
     */
    public IndexBuildResult build(TabularSource source) {
        long startTime = System.currentTimeMillis();
        
        Map<String, ColumnIndex> columns = new LinkedHashMap<>();
        Set<String> unindexed = new LinkedHashSet<>();
        Map<String, InvalidColumnException> failures = new LinkedHashMap<>();
        
        for (Field field : source.getFields()) {
            String name = field.getName();
            try {
                List<Object> values = source.columnValues(name);
                columns.put(name, columnIndexBuilder.build(name, field.getType(), values));
            } catch (InvalidColumnException e) {
                logger.warn("Skipping column {} of {}: {}", name, source.getSourcePath(), e.getMessage());
                unindexed.add(name);
                failures.put(name, e);
            }
        }
        
        FileIndex fileIndex = new FileIndex(
            source.getSourcePath(),
            columns,
            unindexed,
            columnIndexBuilder.getErrorRate(),
            columnIndexBuilder.getRangeFilterThreshold(),
            System.currentTimeMillis()
        );
        
        logger.info("Built index for {}: columns={}, failed={}, took {} ms", 
                   source.getSourcePath(), columns.size(), failures.size(), 
                   System.currentTimeMillis() - startTime);
        
        return new IndexBuildResult(fileIndex, failures);
    }
}
