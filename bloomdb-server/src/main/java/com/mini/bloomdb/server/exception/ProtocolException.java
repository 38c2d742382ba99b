package com.mini.bloomdb.server.exception;

import com.mini.bloomdb.exception.BloomDbException;

/**
 * 协议异常
 * 帧、JSON 或规则树格式错误
 */
public class ProtocolException extends BloomDbException {
    
    private static final long serialVersionUID = 1L;
    
    public ProtocolException(String message) {
        super(message);
    }
    
    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
