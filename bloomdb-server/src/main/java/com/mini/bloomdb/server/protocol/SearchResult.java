package com.mini.bloomdb.server.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 搜索结果
 * 可能匹配的源文件路径，按解析顺序排列；加载失败的索引单独列出
 */
public class SearchResult {
    
    private final List<String> files;
    private final List<LoadFailure> failures;
    
    public SearchResult(List<String> files, List<LoadFailure> failures) {
        this.files = Collections.unmodifiableList(new ArrayList<>(files));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }
    
    public List<String> getFiles() {
        return files;
    }
    
    public List<LoadFailure> getFailures() {
        return failures;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SearchResult that = (SearchResult) o;
        return files.equals(that.files) && failures.equals(that.failures);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(files, failures);
    }
    
    @Override
    public String toString() {
        return "SearchResult{files=" + files + ", failures=" + failures + '}';
    }
    
    /**
     * 加载失败的索引
     */
    public static class LoadFailure {
        private final String location;
        private final String message;
        
        public LoadFailure(String location, String message) {
            this.location = location;
            this.message = message;
        }
        
        public String getLocation() {
            return location;
        }
        
        public String getMessage() {
            return message;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            LoadFailure that = (LoadFailure) o;
            return Objects.equals(location, that.location) && Objects.equals(message, that.message);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(location, message);
        }
        
        @Override
        public String toString() {
            return location + ": " + message;
        }
    }
}
