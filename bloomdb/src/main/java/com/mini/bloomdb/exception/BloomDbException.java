package com.mini.bloomdb.exception;

/**
 * BloomDB 基础异常类
 */
public class BloomDbException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    public BloomDbException(String message) {
        super(message);
    }
    
    public BloomDbException(String message, Throwable cause) {
        super(message, cause);
    }
    
    public BloomDbException(Throwable cause) {
        super(cause);
    }
}
