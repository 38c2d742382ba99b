package com.mini.bloomdb.exception;

/**
 * 配置异常
 * 配置项取值非法时抛出，在任何索引构建之前被拒绝
 */
public class ConfigurationException extends BloomDbException {
    
    private static final long serialVersionUID = 1L;
    
    public ConfigurationException(String message) {
        super(message);
    }
    
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
