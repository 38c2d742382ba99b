package com.mini.bloomdb.index;

import com.mini.bloomdb.exception.InvalidColumnException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个文件的索引构建结果
 * 构建失败的列单独列出，与成功的列区分开
 */
public class IndexBuildResult {
    
    private final FileIndex fileIndex;
    private final Map<String, InvalidColumnException> failures;
    
    public IndexBuildResult(FileIndex fileIndex, Map<String, InvalidColumnException> failures) {
        this.fileIndex = fileIndex;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }
    
    public FileIndex getFileIndex() {
        return fileIndex;
    }
    
    public Map<String, InvalidColumnException> getFailures() {
        return failures;
    }
    
    public boolean isComplete() {
        return failures.isEmpty();
    }
}
