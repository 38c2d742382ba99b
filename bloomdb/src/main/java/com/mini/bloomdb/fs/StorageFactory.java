package com.mini.bloomdb.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;

import java.util.EnumMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * 存储工厂
 * 根据位置的 scheme 选择存储实现，每种 scheme 只创建一个实例
 */
public class StorageFactory {
    
    private static final Logger logger = LoggerFactory.getLogger(StorageFactory.class);
    
    private static volatile StorageFactory instance;
    
    private final Map<Storage.Scheme, Storage> storages = new EnumMap<>(Storage.Scheme.class);
    
    public StorageFactory() {
    }
    
    public static StorageFactory getInstance() {
        if (instance == null) {
            synchronized (StorageFactory.class) {
                if (instance == null) {
                    instance = new StorageFactory();
                }
            }
        }
        return instance;
    }
    
    /**
     * 根据位置获取存储实现
     * @throws IllegalArgumentException scheme 不受支持
     */
    public Storage getStorage(String location) {
        return getStorage(Storage.Scheme.fromPath(requireNonNull(location, "location is null")));
    }
    
    public synchronized Storage getStorage(Storage.Scheme scheme) {
        Storage storage = storages.get(scheme);
        if (storage == null) {
            storage = createStorage(scheme);
            storages.put(scheme, storage);
            logger.info("Created storage for scheme {}", scheme);
        }
        return storage;
    }
    
    private Storage createStorage(Storage.Scheme scheme) {
        switch (scheme) {
            case file:
                return new LocalStorage();
            case s3:
                // 使用默认的凭证和区域解析链
                return new S3Storage(S3Client.create());
            default:
                throw new IllegalArgumentException("Unsupported storage scheme: " + scheme);
        }
    }
}
