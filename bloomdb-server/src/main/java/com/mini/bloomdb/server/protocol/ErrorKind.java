package com.mini.bloomdb.server.protocol;

/**
 * 错误响应的类别
 */
public enum ErrorKind {
    PROTOCOL,  // 请求格式错误
    STORE,     // 索引源不存在或无法列出
    INTERNAL   // 其他服务端错误
}
