package com.mini.bloomdb.server;

import com.mini.bloomdb.exception.StoreException;
import com.mini.bloomdb.fs.FileNamePattern;
import com.mini.bloomdb.index.FileIndex;
import com.mini.bloomdb.io.IndexStore;
import com.mini.bloomdb.query.QueryEvaluator;
import com.mini.bloomdb.server.exception.ProtocolException;
import com.mini.bloomdb.server.protocol.SearchRequest;
import com.mini.bloomdb.server.protocol.SearchResult;
import com.mini.bloomdb.utils.IndexPathFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * 搜索服务
 * 解析索引源和文件名模式，逐个加载文件索引并求值，收集可能匹配的源文件
 * 
 * 单个索引加载失败时排除该文件并在结果中报告，其余文件照常处理。
 */
public class SearchService {
    
    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);
    
    private final IndexStore indexStore;
    private final IndexPathFactory pathFactory;
    
    /** 为 null 时不使用缓存 */
    private final IndexCache indexCache;
    
    public SearchService(IndexStore indexStore, IndexPathFactory pathFactory, IndexCache indexCache) {
        this.indexStore = indexStore;
        this.pathFactory = pathFactory;
        this.indexCache = indexCache;
    }
    
    public static SearchService create(ServerOptions options) {
        IndexCache cache = options.isCacheEnabled() 
                ? new IndexCache(options.getCacheMaxEntries(), options.getCacheExpireMillis()) 
                : null;
        return new SearchService(new IndexStore(), new IndexPathFactory(options.getIndexRoot()), cache);
    }
    
    public SearchResult search(SearchRequest request) {
        return search(request, () -> false);
    }
    
    /**
     * 执行搜索
     * @param cancelled 每个文件处理前检查，返回 true 时放弃本次请求
     * @throws ProtocolException 索引源或文件名模式非法
     * @throws StoreException 索引源不存在或无法列出
     * @throws CancellationException 请求被取消
     */
    public SearchResult search(SearchRequest request, BooleanSupplier cancelled) {
        long startTime = System.currentTimeMillis();
        
        List<String> locations = resolve(request);
        
        List<String> files = new ArrayList<>();
        List<SearchResult.LoadFailure> failures = new ArrayList<>();
        for (String location : locations) {
            if (cancelled.getAsBoolean()) {
                logger.info("Search cancelled after {} of {} files", 
                           files.size() + failures.size(), locations.size());
                throw new CancellationException("Search cancelled: " + request.getIndexSource());
            }
            
            FileIndex fileIndex;
            try {
                fileIndex = load(location);
            } catch (StoreException e) {
                logger.warn("Excluding {} from results: {}", location, e.getMessage());
                failures.add(new SearchResult.LoadFailure(location, e.getMessage()));
                continue;
            }
            
            if (QueryEvaluator.evaluate(request.getQuery(), fileIndex)) {
                files.add(fileIndex.getSourcePath());
            }
        }
        
        logger.info("Search completed: source={}, pattern={}, candidates={}, matched={}, failed={}, took {} ms",
                   request.getIndexSource(), request.getFilePattern(), locations.size(), 
                   files.size(), failures.size(), System.currentTimeMillis() - startTime);
        return new SearchResult(files, failures);
    }
    
    /**
     * 解析索引源下匹配模式的索引位置，按名称排序
     */
    List<String> resolve(SearchRequest request) {
        String indexSource;
        try {
            indexSource = pathFactory.resolveIndexSource(request.getIndexSource());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(e.getMessage(), e);
        }
        
        FileNamePattern pattern;
        try {
            pattern = new FileNamePattern(request.getFilePattern());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid file pattern '" + request.getFilePattern() + "': " 
                    + e.getMessage(), e);
        }
        
        return indexStore.list(indexSource, pattern);
    }
    
    private FileIndex load(String location) {
        if (indexCache == null) {
            return indexStore.read(location);
        }
        return indexCache.get(location, indexStore::read);
    }
}
