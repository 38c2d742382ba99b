package com.mini.bloomdb.server;

import com.mini.bloomdb.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 服务端配置测试
 */
public class ServerOptionsTest {
    
    @Test
    public void testDefaults() {
        Map<String, String> config = new HashMap<>();
        config.put(ServerOptions.INDEX_ROOT, "/indexes");
        ServerOptions options = ServerOptions.fromMap(config);
        
        assertEquals("/indexes", options.getIndexRoot());
        assertEquals(ServerOptions.DEFAULT_HOST, options.getHost());
        assertEquals(ServerOptions.DEFAULT_PORT, options.getPort());
        assertEquals(ServerOptions.DEFAULT_READ_TIMEOUT_MS, options.getReadTimeoutMillis());
        assertTrue(options.isCacheEnabled());
        assertTrue(options.getWorkerThreads() > 0);
    }
    
    @Test
    public void testFromMap() {
        Map<String, String> config = new HashMap<>();
        config.put(ServerOptions.INDEX_ROOT, " s3://bucket/idx ");
        config.put(ServerOptions.HOST, "0.0.0.0");
        config.put(ServerOptions.PORT, "0");
        config.put(ServerOptions.WORKER_THREADS, "4");
        config.put(ServerOptions.CACHE_ENABLED, "FALSE");
        config.put(ServerOptions.CACHE_EXPIRE_MS, "60000");
        ServerOptions options = ServerOptions.fromMap(config);
        
        assertEquals("s3://bucket/idx", options.getIndexRoot());
        assertEquals("0.0.0.0", options.getHost());
        assertEquals(0, options.getPort());
        assertEquals(4, options.getWorkerThreads());
        assertFalse(options.isCacheEnabled());
        assertEquals(60_000L, options.getCacheExpireMillis());
    }
    
    @Test
    public void testInvalidOptions() {
        assertThrows(ConfigurationException.class, () -> ServerOptions.builder().build());
        assertThrows(ConfigurationException.class, 
            () -> ServerOptions.builder().indexRoot("/i").port(70000).build());
        assertThrows(ConfigurationException.class, 
            () -> ServerOptions.builder().indexRoot("/i").workerThreads(0).build());
        
        Map<String, String> config = new HashMap<>();
        config.put(ServerOptions.INDEX_ROOT, "/i");
        config.put(ServerOptions.PORT, "eighty");
        assertThrows(ConfigurationException.class, () -> ServerOptions.fromMap(config));
        
        config.put(ServerOptions.PORT, "80");
        config.put(ServerOptions.CACHE_ENABLED, "yes");
        assertThrows(ConfigurationException.class, () -> ServerOptions.fromMap(config));
    }
}
