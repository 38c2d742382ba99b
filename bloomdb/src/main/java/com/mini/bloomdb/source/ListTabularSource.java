package com.mini.bloomdb.source;

import com.mini.bloomdb.exception.DataSourceException;
import com.mini.bloomdb.schema.DataType;
import com.mini.bloomdb.schema.Field;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于内存列表的数据源
 * 适用于数据已经在内存中的场景
 */
public class ListTabularSource implements TabularSource {
    
    private final String sourcePath;
    private final List<Field> fields;
    private final Map<String, List<Object>> columns;
    
    private ListTabularSource(String sourcePath, List<Field> fields, Map<String, List<Object>> columns) {
        this.sourcePath = sourcePath;
        this.fields = Collections.unmodifiableList(fields);
        this.columns = columns;
    }
    
    @Override
    public String getSourcePath() {
        return sourcePath;
    }
    
    @Override
    public List<Field> getFields() {
        return fields;
    }
    
    @Override
    public List<Object> columnValues(String column) {
        List<Object> values = columns.get(column);
        if (values == null) {
            throw new DataSourceException("Column " + column + " not found in " + sourcePath);
        }
        return values;
    }
    
    public static Builder builder(String sourcePath) {
        return new Builder(sourcePath);
    }
    
    public static class Builder {
        private final String sourcePath;
        private final List<Field> fields = new ArrayList<>();
        private final Map<String, List<Object>> columns = new LinkedHashMap<>();
        
        private Builder(String sourcePath) {
            this.sourcePath = sourcePath;
        }
        
        public Builder column(String name, DataType type, Object... values) {
            return column(name, type, Arrays.asList(values));
        }
        
        public Builder column(String name, DataType type, List<?> values) {
            if (columns.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate column: " + name);
            }
            fields.add(new Field(name, type));
            columns.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
            return this;
        }
        
        public ListTabularSource build() {
            return new ListTabularSource(sourcePath, new ArrayList<>(fields), new LinkedHashMap<>(columns));
        }
    }
}
