package com.mini.bloomdb.exception;

/**
 * 列数据不适合所选索引类型时抛出
 * 只影响该列的构建，不影响同一文件的其他列
 */
public class InvalidColumnException extends BloomDbException {
    
    private static final long serialVersionUID = 1L;
    
    private final String column;
    
    public InvalidColumnException(String column, String message) {
        super("Invalid column '" + column + "': " + message);
        this.column = column;
    }
    
    public InvalidColumnException(String column, String message, Throwable cause) {
        super("Invalid column '" + column + "': " + message, cause);
        this.column = column;
    }
    
    public String getColumn() {
        return column;
    }
}
