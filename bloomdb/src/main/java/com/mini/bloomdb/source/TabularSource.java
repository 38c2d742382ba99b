package com.mini.bloomdb.source;

import com.mini.bloomdb.schema.Field;

import java.util.List;

/**
 * 表格数据源
 * 按列提供一个数据文件中的全部值，行顺序对索引构建没有意义
 */
public interface TabularSource {
    
    /**
     * 源文件路径，作为文件索引的标识
     */
    String getSourcePath();
    
    /**
     * 按文件中的顺序返回所有列
     */
    List<Field> getFields();
    
    /**
     * 返回某一列的全部值（已解析为列类型，空值为 null）
     * @throws com.mini.bloomdb.exception.DataSourceException 列不存在或读取失败
     * @throws com.mini.bloomdb.exception.InvalidColumnException 列的类型无法建立索引
     */
    List<Object> columnValues(String column);
}
