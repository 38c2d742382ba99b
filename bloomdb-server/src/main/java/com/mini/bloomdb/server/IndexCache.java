package com.mini.bloomdb.server;

import com.mini.bloomdb.index.FileIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.LongSupplier;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 文件索引缓存
 * 按索引位置缓存反序列化后的文件索引，避免每个请求重复读取存储
 * 
 * 条目不可变；过期或超出容量时按最久未访问的顺序淘汰。
 */
public class IndexCache {
    private static final Logger logger = LoggerFactory.getLogger(IndexCache.class);
    
    // Key: 索引位置
    private final Map<String, CachedIndex> cache = new ConcurrentHashMap<>();
    
    private final int maxEntries;
    private final long expireMillis;
    private final LongSupplier clock;
    
    // 访问序号，比时间戳更能区分同一毫秒内的访问
    private final AtomicLong accessCounter = new AtomicLong();
    
    public IndexCache(int maxEntries, long expireMillis) {
        this(maxEntries, expireMillis, System::currentTimeMillis);
    }
    
    IndexCache(int maxEntries, long expireMillis, LongSupplier clock) {
        checkArgument(maxEntries > 0, "maxEntries must be positive: %s", maxEntries);
        checkArgument(expireMillis > 0, "expireMillis must be positive: %s", expireMillis);
        this.maxEntries = maxEntries;
        this.expireMillis = expireMillis;
        this.clock = clock;
    }
    
    /**
     * 获取文件索引，缓存未命中或已过期时用 loader 加载
     * loader 抛出的异常直接传给调用方，不缓存失败结果
     */
    public FileIndex get(String location, Function<String, FileIndex> loader) {
        long now = clock.getAsLong();
        CachedIndex cached = cache.get(location);
        if (cached != null && !cached.isExpired(now, expireMillis)) {
            logger.debug("Index cache hit: {}", location);
            cached.lastAccess = accessCounter.incrementAndGet();
            return cached.fileIndex;
        }
        
        logger.debug("Index cache miss: {}, loading", location);
        FileIndex fileIndex = loader.apply(location);
        
        if (cache.size() >= maxEntries && !cache.containsKey(location)) {
            clearExpired();
            while (cache.size() >= maxEntries) {
                evictLRU();
            }
        }
        cache.put(location, new CachedIndex(fileIndex, now, accessCounter.incrementAndGet()));
        return fileIndex;
    }
    
    /**
     * 淘汰最久未访问的条目
     */
    private void evictLRU() {
        String lruKey = null;
        long oldest = Long.MAX_VALUE;
        for (Map.Entry<String, CachedIndex> entry : cache.entrySet()) {
            if (entry.getValue().lastAccess < oldest) {
                oldest = entry.getValue().lastAccess;
                lruKey = entry.getKey();
            }
        }
        if (lruKey == null) {
            return;
        }
        cache.remove(lruKey);
        logger.debug("Evicted index from cache: {}", lruKey);
    }
    
    /**
     * 清除过期条目
     */
    public void clearExpired() {
        long now = clock.getAsLong();
        List<String> expiredKeys = new ArrayList<>();
        for (Map.Entry<String, CachedIndex> entry : cache.entrySet()) {
            if (entry.getValue().isExpired(now, expireMillis)) {
                expiredKeys.add(entry.getKey());
            }
        }
        for (String key : expiredKeys) {
            cache.remove(key);
        }
        if (!expiredKeys.isEmpty()) {
            logger.debug("Cleared {} expired index cache entries", expiredKeys.size());
        }
    }
    
    public void invalidate(String location) {
        cache.remove(location);
    }
    
    public void clearAll() {
        cache.clear();
        logger.info("Cleared all index cache");
    }
    
    public int size() {
        return cache.size();
    }
    
    public boolean contains(String location) {
        return cache.containsKey(location);
    }
    
    private static class CachedIndex {
        final FileIndex fileIndex;
        final long cacheTime;
        volatile long lastAccess;
        
        CachedIndex(FileIndex fileIndex, long cacheTime, long lastAccess) {
            this.fileIndex = fileIndex;
            this.cacheTime = cacheTime;
            this.lastAccess = lastAccess;
        }
        
        boolean isExpired(long now, long expirationMs) {
            return now - cacheTime > expirationMs;
        }
    }
}
