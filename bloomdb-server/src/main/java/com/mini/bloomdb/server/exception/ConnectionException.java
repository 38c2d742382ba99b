package com.mini.bloomdb.server.exception;

import com.mini.bloomdb.exception.BloomDbException;

/**
 * 连接异常
 * 连接被拒绝、收到响应前连接关闭或超时
 */
public class ConnectionException extends BloomDbException {
    
    private static final long serialVersionUID = 1L;
    
    public ConnectionException(String message) {
        super(message);
    }
    
    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
