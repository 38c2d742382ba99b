package com.mini.bloomdb.server.exception;

import com.mini.bloomdb.exception.BloomDbException;
import com.mini.bloomdb.server.protocol.ErrorKind;

/**
 * 服务端返回的错误响应
 */
public class SearchException extends BloomDbException {
    
    private static final long serialVersionUID = 1L;
    
    private final ErrorKind kind;
    
    public SearchException(ErrorKind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }
    
    public ErrorKind getKind() {
        return kind;
    }
}
