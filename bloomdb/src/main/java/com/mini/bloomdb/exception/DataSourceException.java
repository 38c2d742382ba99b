package com.mini.bloomdb.exception;

/**
 * 数据源异常
 * 数据文件无法打开或解析时抛出
 */
public class DataSourceException extends BloomDbException {
    
    private static final long serialVersionUID = 1L;
    
    public DataSourceException(String message) {
        super(message);
    }
    
    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
