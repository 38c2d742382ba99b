package com.mini.bloomdb.fs;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * 存储后端接口
 * 本地磁盘和对象存储实现同一套契约，由位置字符串的 scheme 决定使用哪个实现
 */
public interface Storage {
    
    /**
     * 支持的存储 scheme
     */
    enum Scheme {
        file,  // 本地文件系统
        s3;    // Amazon S3
        
        /**
         * 从带 scheme 前缀的路径中解析 scheme
         * @return 没有 scheme 前缀时返回 {@link #file}
         * @throws IllegalArgumentException scheme 不受支持
         */
        public static Scheme fromPath(String location) {
            int idx = location.indexOf("://");
            if (idx < 0) {
                return file;
            }
            String name = location.substring(0, idx).toLowerCase(Locale.ROOT);
            for (Scheme scheme : values()) {
                if (scheme.name().equals(name)) {
                    return scheme;
                }
            }
            throw new IllegalArgumentException("Unsupported storage scheme in location: " + location);
        }
    }
    
    Scheme getScheme();
    
    /**
     * 读取整个对象
     * @throws java.nio.file.NoSuchFileException 位置不存在
     */
    byte[] get(String location) throws IOException;
    
    /**
     * 写入整个对象，覆盖已有内容
     */
    void put(String location, byte[] data) throws IOException;
    
    /**
     * 列出目录下文件名匹配模式的直接子文件，按名称排序
     * @param prefix 目录位置
     * @param pattern 文件名匹配模式
     * @return 子文件的完整位置
     * @throws java.nio.file.NoSuchFileException 目录不存在
     */
    List<String> list(String prefix, FileNamePattern pattern) throws IOException;
    
    boolean exists(String location) throws IOException;
    
    /**
     * 拼接父位置和子名称
     */
    default String join(String parent, String child) {
        if (parent.isEmpty()) {
            return child;
        }
        return parent.endsWith("/") ? parent + child : parent + "/" + child;
    }
    
    /**
     * 取位置中的文件名部分
     */
    static String fileName(String location) {
        String trimmed = location.endsWith("/") 
                ? location.substring(0, location.length() - 1) : location;
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }
}
