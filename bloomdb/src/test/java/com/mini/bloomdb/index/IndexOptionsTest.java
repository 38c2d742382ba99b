package com.mini.bloomdb.index;

import com.mini.bloomdb.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IndexOptions 配置解析测试
 */
public class IndexOptionsTest {
    
    @Test
    public void testDefaults() {
        IndexOptions options = IndexOptions.fromMap(new HashMap<>());
        
        assertEquals(IndexOptions.DEFAULT_ERROR_RATE, options.getErrorRate());
        assertEquals(IndexOptions.DEFAULT_RANGE_FILTER_THRESHOLD, options.getRangeFilterThreshold());
        assertEquals(Runtime.getRuntime().availableProcessors(), options.getParallelism());
    }
    
    @Test
    public void testFromMap() {
        Map<String, String> map = new HashMap<>();
        map.put(IndexOptions.ERROR_RATE, "0.05");
        map.put(IndexOptions.RANGE_FILTER_THRESHOLD, " 200 ");
        map.put(IndexOptions.PARALLELISM, "2");
        
        IndexOptions options = IndexOptions.fromMap(map);
        assertEquals(0.05, options.getErrorRate());
        assertEquals(200, options.getRangeFilterThreshold());
        assertEquals(2, options.getParallelism());
    }
    
    @Test
    public void testInvalidValues() {
        Map<String, String> map = new HashMap<>();
        map.put(IndexOptions.ERROR_RATE, "often");
        assertThrows(ConfigurationException.class, () -> IndexOptions.fromMap(map));
        
        map.put(IndexOptions.ERROR_RATE, "1.5");
        assertThrows(ConfigurationException.class, () -> IndexOptions.fromMap(map));
        
        assertThrows(ConfigurationException.class, 
            () -> IndexOptions.builder().parallelism(0).build());
    }
}
