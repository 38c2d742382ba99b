package com.mini.bloomdb.server;

import com.mini.bloomdb.exception.ConfigurationException;

import java.util.Map;

/**
 * 搜索服务配置选项
 */
public class ServerOptions {
    
    public static final String HOST = "server.host";
    public static final String PORT = "server.port";
    public static final String INDEX_ROOT = "server.index-root";
    public static final String WORKER_THREADS = "server.worker-threads";
    public static final String READ_TIMEOUT_MS = "server.read-timeout-ms";
    public static final String MAX_FRAME_BYTES = "server.max-frame-bytes";
    public static final String CACHE_ENABLED = "server.cache.enabled";
    public static final String CACHE_MAX_ENTRIES = "server.cache.max-entries";
    public static final String CACHE_EXPIRE_MS = "server.cache.expire-ms";
    
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8888;
    public static final long DEFAULT_READ_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;
    public static final int DEFAULT_CACHE_MAX_ENTRIES = 1000;
    public static final long DEFAULT_CACHE_EXPIRE_MS = 5 * 60 * 1000L;
    
    private final String host;
    
    /** 0 表示由系统分配端口 */
    private final int port;
    
    /** 索引根目录，请求中的索引源相对于它解析 */
    private final String indexRoot;
    
    /** 处理请求的业务线程数 */
    private final int workerThreads;
    
    private final long readTimeoutMillis;
    private final int maxFrameBytes;
    
    private final boolean cacheEnabled;
    private final int cacheMaxEntries;
    private final long cacheExpireMillis;
    
    private ServerOptions(Builder builder) {
        if (builder.host == null || builder.host.trim().isEmpty()) {
            throw new ConfigurationException(HOST + " must not be empty");
        }
        if (builder.port < 0 || builder.port > 65535) {
            throw new ConfigurationException(PORT + " must be in [0, 65535], got " + builder.port);
        }
        if (builder.indexRoot == null || builder.indexRoot.trim().isEmpty()) {
            throw new ConfigurationException(INDEX_ROOT + " is required");
        }
        checkPositive(WORKER_THREADS, builder.workerThreads);
        checkPositive(READ_TIMEOUT_MS, builder.readTimeoutMillis);
        checkPositive(MAX_FRAME_BYTES, builder.maxFrameBytes);
        checkPositive(CACHE_MAX_ENTRIES, builder.cacheMaxEntries);
        checkPositive(CACHE_EXPIRE_MS, builder.cacheExpireMillis);
        
        this.host = builder.host.trim();
        this.port = builder.port;
        this.indexRoot = builder.indexRoot.trim();
        this.workerThreads = builder.workerThreads;
        this.readTimeoutMillis = builder.readTimeoutMillis;
        this.maxFrameBytes = builder.maxFrameBytes;
        this.cacheEnabled = builder.cacheEnabled;
        this.cacheMaxEntries = builder.cacheMaxEntries;
        this.cacheExpireMillis = builder.cacheExpireMillis;
    }
    
    private static void checkPositive(String key, long value) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive, got " + value);
        }
    }
    
    public String getHost() {
        return host;
    }
    
    public int getPort() {
        return port;
    }
    
    public String getIndexRoot() {
        return indexRoot;
    }
    
    public int getWorkerThreads() {
        return workerThreads;
    }
    
    public long getReadTimeoutMillis() {
        return readTimeoutMillis;
    }
    
    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }
    
    public boolean isCacheEnabled() {
        return cacheEnabled;
    }
    
    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }
    
    public long getCacheExpireMillis() {
        return cacheExpireMillis;
    }
    
    /**
     * 从字符串配置构建，未配置的项使用默认值
     */
    public static ServerOptions fromMap(Map<String, String> options) {
        Builder builder = builder();
        String value = options.get(HOST);
        if (value != null) {
            builder.host(value);
        }
        value = options.get(PORT);
        if (value != null) {
            builder.port((int) parseLong(PORT, value));
        }
        value = options.get(INDEX_ROOT);
        if (value != null) {
            builder.indexRoot(value);
        }
        value = options.get(WORKER_THREADS);
        if (value != null) {
            builder.workerThreads((int) parseLong(WORKER_THREADS, value));
        }
        value = options.get(READ_TIMEOUT_MS);
        if (value != null) {
            builder.readTimeoutMillis(parseLong(READ_TIMEOUT_MS, value));
        }
        value = options.get(MAX_FRAME_BYTES);
        if (value != null) {
            builder.maxFrameBytes((int) parseLong(MAX_FRAME_BYTES, value));
        }
        value = options.get(CACHE_ENABLED);
        if (value != null) {
            builder.cacheEnabled(parseBoolean(CACHE_ENABLED, value));
        }
        value = options.get(CACHE_MAX_ENTRIES);
        if (value != null) {
            builder.cacheMaxEntries((int) parseLong(CACHE_MAX_ENTRIES, value));
        }
        value = options.get(CACHE_EXPIRE_MS);
        if (value != null) {
            builder.cacheExpireMillis(parseLong(CACHE_EXPIRE_MS, value));
        }
        return builder.build();
    }
    
    private static long parseLong(String key, String value) {
        try {
            long parsed = Long.parseLong(value.trim());
            if ((parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) && !key.endsWith("-ms")) {
                throw new ConfigurationException(key + " is too large: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }
    
    private static boolean parseBoolean(String key, String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) {
            return true;
        }
        if (v.equalsIgnoreCase("false")) {
            return false;
        }
        throw new ConfigurationException(key + " is not a boolean: " + value);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return "ServerOptions{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", indexRoot='" + indexRoot + '\'' +
                ", workerThreads=" + workerThreads +
                ", readTimeoutMillis=" + readTimeoutMillis +
                ", maxFrameBytes=" + maxFrameBytes +
                ", cacheEnabled=" + cacheEnabled +
                ", cacheMaxEntries=" + cacheMaxEntries +
                ", cacheExpireMillis=" + cacheExpireMillis +
                '}';
    }
    
    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String indexRoot;
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private long readTimeoutMillis = DEFAULT_READ_TIMEOUT_MS;
        private int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;
        private boolean cacheEnabled = true;
        private int cacheMaxEntries = DEFAULT_CACHE_MAX_ENTRIES;
        private long cacheExpireMillis = DEFAULT_CACHE_EXPIRE_MS;
        
        public Builder host(String host) {
            this.host = host;
            return this;
        }
        
        public Builder port(int port) {
            this.port = port;
            return this;
        }
        
        public Builder indexRoot(String indexRoot) {
            this.indexRoot = indexRoot;
            return this;
        }
        
        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }
        
        public Builder readTimeoutMillis(long readTimeoutMillis) {
            this.readTimeoutMillis = readTimeoutMillis;
            return this;
        }
        
        public Builder maxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }
        
        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }
        
        public Builder cacheMaxEntries(int cacheMaxEntries) {
            this.cacheMaxEntries = cacheMaxEntries;
            return this;
        }
        
        public Builder cacheExpireMillis(long cacheExpireMillis) {
            this.cacheExpireMillis = cacheExpireMillis;
            return this;
        }
        
        public ServerOptions build() {
            return new ServerOptions(this);
        }
    }
}
