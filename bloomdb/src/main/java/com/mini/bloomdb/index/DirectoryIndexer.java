package com.mini.bloomdb.index;

import com.mini.bloomdb.exception.BloomDbException;
import com.mini.bloomdb.exception.DataSourceException;
import com.mini.bloomdb.fs.FileNamePattern;
import com.mini.bloomdb.fs.Storage;
import com.mini.bloomdb.fs.StorageFactory;
import com.mini.bloomdb.io.IndexStore;
import com.mini.bloomdb.source.TabularSource;
import com.mini.bloomdb.source.TabularSourceFactory;
import com.mini.bloomdb.utils.IndexPathFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 目录索引器
 * 为输入目录下的每个数据文件构建文件索引，写入输出目录
 * 
 * 文件之间并行处理，单个文件内部单线程构建。
 * 一个文件失败不影响其他文件，失败原因记录在汇总结果中。
 */
public class DirectoryIndexer implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(DirectoryIndexer.class);
    
    public static final FileNamePattern DEFAULT_PATTERN = new FileNamePattern("*.{csv,parquet}");
    
    private final FileIndexBuilder fileIndexBuilder;
    private final IndexStore indexStore;
    private final StorageFactory storageFactory;
    private final int parallelism;
    private final ExecutorService executorService;
    
    public DirectoryIndexer(IndexOptions options) {
        this(options, new IndexStore(), StorageFactory.getInstance());
    }
    
    public DirectoryIndexer(IndexOptions options, IndexStore indexStore, StorageFactory storageFactory) {
        this.fileIndexBuilder = new FileIndexBuilder(options);
        this.indexStore = indexStore;
        this.storageFactory = storageFactory;
        this.parallelism = options.getParallelism();
        this.executorService = createExecutorService(parallelism);
    }
    
    public IndexingSummary indexDirectory(String inputDir, String outputDir) {
        return indexDirectory(inputDir, outputDir, DEFAULT_PATTERN);
    }
    
    /**
     * 为输入目录下文件名匹配的数据文件构建索引
     * @param inputDir 数据文件目录
     * @param outputDir 索引输出目录
     * @param pattern 数据文件名通配符
     * @throws DataSourceException 输入目录无法列出
     */
    public IndexingSummary indexDirectory(String inputDir, String outputDir, FileNamePattern pattern) {
        List<String> sources;
        try {
            Storage storage = storageFactory.getStorage(inputDir);
            sources = storage.list(inputDir, pattern);
        } catch (IOException | IllegalArgumentException e) {
            throw new DataSourceException("Failed to list input directory " + inputDir, e);
        }
        
        logger.info("Indexing {} files from {} into {} with parallelism {}", 
                   sources.size(), inputDir, outputDir, parallelism);
        long startTime = System.currentTimeMillis();
        
        IndexPathFactory pathFactory = new IndexPathFactory(outputDir);
        List<Future<IndexingSummary.IndexedFile>> futures = new ArrayList<>();
        for (String source : sources) {
            futures.add(executorService.submit(() -> indexFile(source, pathFactory)));
        }
        
        List<IndexingSummary.IndexedFile> indexed = new ArrayList<>();
        Map<String, BloomDbException> failures = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            String source = sources.get(i);
            try {
                indexed.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DataSourceException("Indexing interrupted", e);
            } catch (ExecutionException e) {
                BloomDbException failure = asBloomDbException(source, e.getCause());
                logger.error("Failed to index {}: {}", source, failure.getMessage());
                failures.put(source, failure);
            }
        }
        
        IndexingSummary summary = new IndexingSummary(
            indexed, failures, System.currentTimeMillis() - startTime);
        logger.info("Indexing completed: {}", summary);
        return summary;
    }
    
    private IndexingSummary.IndexedFile indexFile(String source, IndexPathFactory pathFactory) {
        TabularSource tabularSource = TabularSourceFactory.open(storageFactory.getStorage(source), source);
        IndexBuildResult result = fileIndexBuilder.build(tabularSource);
        String indexLocation = pathFactory.indexLocation(source);
        indexStore.write(result.getFileIndex(), indexLocation);
        return new IndexingSummary.IndexedFile(source, indexLocation, result);
    }
    
    private static BloomDbException asBloomDbException(String source, Throwable cause) {
        if (cause instanceof BloomDbException) {
            return (BloomDbException) cause;
        }
        return new DataSourceException("Failed to index " + source + ": " + cause.getMessage(), cause);
    }
    
    private ExecutorService createExecutorService(int parallelism) {
        return new ThreadPoolExecutor(
            parallelism, parallelism,
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            new ThreadFactory() {
                private final AtomicInteger threadNumber = new AtomicInteger(1);
                @Override
                public Thread newThread(Runnable r) {
                    Thread t = new Thread(r, "index-builder-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                }
            }
        );
    }
    
    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
