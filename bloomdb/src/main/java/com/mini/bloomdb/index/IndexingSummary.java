package com.mini.bloomdb.index;

import com.mini.bloomdb.exception.BloomDbException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 目录索引的汇总结果
 * 成功的文件按源文件顺序列出，失败的文件单独记录原因
 */
public class IndexingSummary {
    
    private final List<IndexedFile> indexedFiles;
    private final Map<String, BloomDbException> failures;
    private final long durationMillis;
    
    public IndexingSummary(List<IndexedFile> indexedFiles, 
                           Map<String, BloomDbException> failures,
                           long durationMillis) {
        this.indexedFiles = Collections.unmodifiableList(indexedFiles);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.durationMillis = durationMillis;
    }
    
    public List<IndexedFile> getIndexedFiles() {
        return indexedFiles;
    }
    
    /**
     * 源文件位置 -> 失败原因
     */
    public Map<String, BloomDbException> getFailures() {
        return failures;
    }
    
    public boolean isSuccessful() {
        return failures.isEmpty();
    }
    
    public long getDurationMillis() {
        return durationMillis;
    }
    
    @Override
    public String toString() {
        return "IndexingSummary{" +
                "indexed=" + indexedFiles.size() +
                ", failed=" + failures.size() +
                ", durationMillis=" + durationMillis +
                '}';
    }
    
    /**
     * 一个成功写出索引的源文件
     */
    public static class IndexedFile {
        private final String sourcePath;
        private final String indexLocation;
        private final IndexBuildResult buildResult;
        
        public IndexedFile(String sourcePath, String indexLocation, IndexBuildResult buildResult) {
            this.sourcePath = sourcePath;
            this.indexLocation = indexLocation;
            this.buildResult = buildResult;
        }
        
        public String getSourcePath() {
            return sourcePath;
        }
        
        public String getIndexLocation() {
            return indexLocation;
        }
        
        public IndexBuildResult getBuildResult() {
            return buildResult;
        }
    }
}
