package com.mini.bloomdb.server.protocol;

import com.mini.bloomdb.query.Rule;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * 搜索请求
 */
public class SearchRequest {
    
    /** 索引源，相对于服务端索引根目录 */
    private final String indexSource;
    
    /** 源文件名通配符 */
    private final String filePattern;
    
    private final Rule query;
    
    public SearchRequest(String indexSource, String filePattern, Rule query) {
        this.indexSource = requireNonNull(indexSource, "indexSource is null");
        this.filePattern = requireNonNull(filePattern, "filePattern is null");
        this.query = requireNonNull(query, "query is null");
    }
    
    public String getIndexSource() {
        return indexSource;
    }
    
    public String getFilePattern() {
        return filePattern;
    }
    
    public Rule getQuery() {
        return query;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SearchRequest that = (SearchRequest) o;
        return indexSource.equals(that.indexSource) 
                && filePattern.equals(that.filePattern) 
                && query.equals(that.query);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(indexSource, filePattern, query);
    }
    
    @Override
    public String toString() {
        return "SearchRequest{" +
                "indexSource='" + indexSource + '\'' +
                ", filePattern='" + filePattern + '\'' +
                ", query=" + query +
                '}';
    }
}
