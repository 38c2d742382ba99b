package com.mini.bloomdb.io;

import com.mini.bloomdb.exception.StoreException.StoreReadException;
import com.mini.bloomdb.exception.StoreException.StoreWriteException;
import com.mini.bloomdb.fs.FileNamePattern;
import com.mini.bloomdb.fs.Storage;
import com.mini.bloomdb.fs.StorageFactory;
import com.mini.bloomdb.index.FileIndex;
import com.mini.bloomdb.index.FileIndexSerializer;
import com.mini.bloomdb.utils.IndexPathFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;

/**
 * 索引文件读写器
 * 负责文件索引在本地磁盘或对象存储上的持久化和加载
 * 
 * 存储后端由位置的 scheme 决定，写入是整体替换。
 */
public class IndexStore {
    
    private static final Logger logger = LoggerFactory.getLogger(IndexStore.class);
    
    private final StorageFactory storageFactory;
    
    public IndexStore() {
        this(StorageFactory.getInstance());
    }
    
    public IndexStore(StorageFactory storageFactory) {
        this.storageFactory = storageFactory;
    }
    
    /**
     * 保存文件索引
     * @param fileIndex 文件索引
     * @param location 目标位置，已存在时覆盖
     * @return 写入的字节数
     * @throws StoreWriteException 序列化或写入失败
     */
    public int write(FileIndex fileIndex, String location) {
        byte[] data;
        try {
            data = FileIndexSerializer.serialize(fileIndex);
        } catch (IOException e) {
            throw new StoreWriteException(location, "serialization failed", e);
        }
        
        try {
            storageFactory.getStorage(location).put(location, data);
        } catch (IOException | RuntimeException e) {
            throw new StoreWriteException(location, String.valueOf(e.getMessage()), e);
        }
        
        logger.info("Saved index: source={}, location={}, size={} bytes", 
                   fileIndex.getSourcePath(), location, data.length);
        return data.length;
    }
    
    /**
     * 加载文件索引
     * @throws StoreReadException 位置不存在、不可读或内容损坏
     * @throws com.mini.bloomdb.exception.StoreException.StoreVersionMismatchException 格式版本不兼容
     */
    public FileIndex read(String location) {
        byte[] data;
        try {
            data = storageFactory.getStorage(location).get(location);
        } catch (NoSuchFileException e) {
            throw new StoreReadException(location, "not found", e);
        } catch (IOException | RuntimeException e) {
            throw new StoreReadException(location, String.valueOf(e.getMessage()), e);
        }
        
        FileIndex fileIndex = FileIndexSerializer.deserialize(location, data);
        
        logger.debug("Loaded index: source={}, location={}, columns={}", 
                    fileIndex.getSourcePath(), location, fileIndex.getColumns().size());
        return fileIndex;
    }
    
    /**
     * 列出索引源下源文件名匹配模式的索引文件
     * @param indexSource 索引所在的目录位置
     * @param sourcePattern 源文件名的通配符，例如 "*.csv"
     * @return 索引文件位置，按名称排序
     * @throws StoreReadException 索引源不存在或无法列出
     */
    public List<String> list(String indexSource, FileNamePattern sourcePattern) {
        try {
            Storage storage = storageFactory.getStorage(indexSource);
            List<String> locations = storage.list(indexSource, IndexPathFactory.indexPattern(sourcePattern));
            logger.debug("Listed {} index files under {} matching {}", 
                        locations.size(), indexSource, sourcePattern);
            return locations;
        } catch (NoSuchFileException e) {
            throw new StoreReadException(indexSource, "index source not found", e);
        } catch (IOException | RuntimeException e) {
            throw new StoreReadException(indexSource, String.valueOf(e.getMessage()), e);
        }
    }
}
