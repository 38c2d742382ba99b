package com.mini.bloomdb.utils;

import com.mini.bloomdb.fs.FileNamePattern;
import com.mini.bloomdb.fs.Storage;

import static java.util.Objects.requireNonNull;

/**
 * 索引路径工厂类
 * 根据源文件名确定索引位置，查询时无需额外的清单文件
 * 
 * 目录结构：
 * indexRoot/
 * ├── {source}.bidx
 * └── {indexSource}/
 *     └── {source}.bidx
 */
public class IndexPathFactory {
    
    public static final String INDEX_SUFFIX = ".bidx";
    
    private final String indexRoot;
    
    public IndexPathFactory(String indexRoot) {
        this.indexRoot = requireNonNull(indexRoot, "indexRoot is null");
    }
    
    public String getIndexRoot() {
        return indexRoot;
    }
    
    /**
     * 源文件对应的索引位置：{indexRoot}/{源文件名}.bidx
     */
    public String indexLocation(String sourcePath) {
        String name = Storage.fileName(sourcePath);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Source path has no file name: " + sourcePath);
        }
        return join(indexRoot, name + INDEX_SUFFIX);
    }
    
    /**
     * 解析请求中的索引源，必须是索引根目录下的相对位置
     * @param indexSource 相对位置；空串或 "." 表示根目录本身
     * @throws IllegalArgumentException 绝对路径、带 scheme 或包含 ".."
     */
    public String resolveIndexSource(String indexSource) {
        requireNonNull(indexSource, "indexSource is null");
        String source = indexSource.trim();
        if (source.isEmpty() || source.equals(".")) {
            return indexRoot;
        }
        if (source.contains("://") || source.startsWith("/") || source.startsWith("\\")) {
            throw new IllegalArgumentException(
                "Index source must be relative to the index root: " + indexSource);
        }
        for (String segment : source.split("[/\\\\]")) {
            if (segment.equals("..")) {
                throw new IllegalArgumentException(
                    "Index source must not leave the index root: " + indexSource);
            }
        }
        return join(indexRoot, source);
    }
    
    /**
     * 索引文件名对应的源文件名
     * @return 不是索引文件时返回 null
     */
    public static String sourceName(String indexFileName) {
        if (!indexFileName.endsWith(INDEX_SUFFIX) || indexFileName.length() == INDEX_SUFFIX.length()) {
            return null;
        }
        return indexFileName.substring(0, indexFileName.length() - INDEX_SUFFIX.length());
    }
    
    /**
     * 将源文件名模式转换为索引文件名模式
     */
    public static FileNamePattern indexPattern(FileNamePattern sourcePattern) {
        return sourcePattern.mapNames(IndexPathFactory::sourceName);
    }
    
    public static String join(String parent, String child) {
        if (parent.isEmpty()) {
            return child;
        }
        return parent.endsWith("/") ? parent + child : parent + "/" + child;
    }
}
