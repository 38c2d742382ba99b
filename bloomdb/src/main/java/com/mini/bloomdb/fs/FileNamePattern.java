package com.mini.bloomdb.fs;

import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.function.Function;

/**
 * shell 风格的文件名通配符匹配
 * 只匹配文件名，不跨越目录
 */
public class FileNamePattern {
    
    public static final FileNamePattern ALL = new FileNamePattern("*");
    
    private final String glob;
    private final PathMatcher matcher;
    private final Function<String, String> nameMapper;
    
    /**
     * @throws IllegalArgumentException 通配符语法错误
     */
    public FileNamePattern(String glob) {
        this(glob, Function.identity());
    }
    
    private FileNamePattern(String glob, Function<String, String> nameMapper) {
        if (glob == null || glob.isEmpty()) {
            throw new IllegalArgumentException("File pattern must not be empty");
        }
        this.glob = glob;
        this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        this.nameMapper = nameMapper;
    }
    
    /**
     * 先用 nameMapper 转换文件名再匹配；nameMapper 返回 null 表示不匹配
     */
    public FileNamePattern mapNames(Function<String, String> nameMapper) {
        return new FileNamePattern(glob, nameMapper);
    }
    
    public boolean matches(String fileName) {
        String name = nameMapper.apply(fileName);
        if (name == null || name.isEmpty() || name.indexOf('\0') >= 0) {
            return false;
        }
        return matcher.matches(Paths.get(name));
    }
    
    public String getGlob() {
        return glob;
    }
    
    @Override
    public String toString() {
        return glob;
    }
}
