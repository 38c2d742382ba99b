package com.mini.bloomdb.exception;

/**
 * 索引存储异常
 * 读写失败都不会在内部重试，直接抛给调用方
 */
public class StoreException extends BloomDbException {
    
    private static final long serialVersionUID = 1L;
    
    public StoreException(String message) {
        super(message);
    }
    
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * 索引读取异常：位置不存在、不可读或内容损坏
     */
    public static class StoreReadException extends StoreException {
        
        private static final long serialVersionUID = 1L;
        
        private final String location;
        
        public StoreReadException(String location, String message) {
            super("Failed to read index " + location + ": " + message);
            this.location = location;
        }
        
        public StoreReadException(String location, String message, Throwable cause) {
            super("Failed to read index " + location + ": " + message, cause);
            this.location = location;
        }
        
        public String getLocation() {
            return location;
        }
    }
    
    /**
     * 索引格式版本不兼容
     */
    public static class StoreVersionMismatchException extends StoreReadException {
        
        private static final long serialVersionUID = 1L;
        
        private final int expectedVersion;
        private final int actualVersion;
        
        public StoreVersionMismatchException(String location, int expectedVersion, int actualVersion) {
            super(location, "unsupported format version " + actualVersion 
                    + " (expected " + expectedVersion + ")");
            this.expectedVersion = expectedVersion;
            this.actualVersion = actualVersion;
        }
        
        public int getExpectedVersion() {
            return expectedVersion;
        }
        
        public int getActualVersion() {
            return actualVersion;
        }
    }
    
    /**
     * 索引写入异常：I/O、权限或序列化失败
     */
    public static class StoreWriteException extends StoreException {
        
        private static final long serialVersionUID = 1L;
        
        private final String location;
        
        public StoreWriteException(String location, String message, Throwable cause) {
            super("Failed to write index " + location + ": " + message, cause);
            this.location = location;
        }
        
        public String getLocation() {
            return location;
        }
    }
}
