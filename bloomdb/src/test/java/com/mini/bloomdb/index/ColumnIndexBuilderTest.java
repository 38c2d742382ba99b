package com.mini.bloomdb.index;

import com.mini.bloomdb.exception.ConfigurationException;
import com.mini.bloomdb.exception.InvalidColumnException;
import com.mini.bloomdb.schema.DataType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 列索引构建测试：索引类型选择、无假阴性、误判率与边界情况
 */
public class ColumnIndexBuilderTest {
    
    @Test
    public void testMembershipBelowThreshold() {
        ColumnIndexBuilder builder = new ColumnIndexBuilder(0.01, 5);
        ColumnIndex index = builder.build("status", Arrays.asList("Active", "Inactive", "Active", null));
        
        assertEquals(IndexType.MEMBERSHIP, index.getIndexType());
        assertEquals(DataType.STRING, index.getDataType());
        assertEquals(2, ((MembershipIndex) index).getElementCount());
        assertTrue(index.contains("Active"));
        assertTrue(index.contains("Inactive"));
    }
    
    @Test
    public void testRangeAtThreshold() {
        // 不同值个数等于阈值时使用范围索引
        ColumnIndexBuilder builder = new ColumnIndexBuilder(0.01, 3);
        ColumnIndex index = builder.build("n", Arrays.asList(5L, 10L, 20L, 10L));
        
        assertEquals(IndexType.RANGE, index.getIndexType());
        RangeIndex range = (RangeIndex) index;
        assertEquals(5L, range.getMinValue());
        assertEquals(20L, range.getMaxValue());
        
        assertTrue(index.contains(7L));
        assertTrue(index.contains(5));
        assertTrue(index.contains(20.0d));
        assertFalse(index.contains(21L));
        assertFalse(index.contains(4L));
        assertFalse(index.contains(7.5d));
        
        // 少一个不同值时使用成员索引
        ColumnIndex membership = builder.build("n", Arrays.asList(5L, 10L));
        assertEquals(IndexType.MEMBERSHIP, membership.getIndexType());
    }
    
    @Test
    public void testRangeBounds() {
        RangeIndex range = (RangeIndex) new ColumnIndexBuilder(0.1, 2)
                .build("price", Arrays.asList(1.5d, 9.5d, 3.0d));
        
        assertTrue(range.mightContainGreater(9.0d, false));
        assertFalse(range.mightContainGreater(9.5d, false));
        assertTrue(range.mightContainGreater(9.5d, true));
        assertTrue(range.mightContainLess(2.0d, false));
        assertFalse(range.mightContainLess(1.5d, false));
        assertTrue(range.mightContainLess(1.5d, true));
        assertFalse(range.mightContainLess("abc", true));
    }
    
    @Test
    public void testNoFalseNegatives() {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            values.add("value-" + i);
        }
        ColumnIndex index = new ColumnIndexBuilder(0.1, 1000).build("c", values);
        
        assertEquals(IndexType.MEMBERSHIP, index.getIndexType());
        for (Object value : values) {
            assertTrue(index.contains(value), "missing " + value);
        }
    }
    
    @Test
    public void testFalsePositiveRate() {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            values.add("present-" + i);
        }
        ColumnIndex index = new ColumnIndexBuilder(0.01, 100_000).build("c", values);
        assertTrue(((MembershipIndex) index).expectedFpp() < 0.02);
        
        int falsePositives = 0;
        int lookups = 10_000;
        for (int i = 0; i < lookups; i++) {
            if (index.contains("absent-" + i)) {
                falsePositives++;
            }
        }
        double rate = (double) falsePositives / lookups;
        assertTrue(rate < 0.03, "false positive rate too high: " + rate);
    }
    
    @Test
    public void testEmptyColumnMatchesNothing() {
        ColumnIndex index = new ColumnIndexBuilder(0.1, 10).build("empty", Arrays.asList(null, null));
        
        assertEquals(IndexType.MEMBERSHIP, index.getIndexType());
        assertTrue(index.isEmpty());
        assertFalse(index.contains("anything"));
        assertFalse(index.contains(""));
        
        assertTrue(new ColumnIndexBuilder(0.1, 10).build("empty", Collections.emptyList()).isEmpty());
    }
    
    @Test
    public void testNumericProbeAgainstIntegerColumn() {
        ColumnIndex index = new ColumnIndexBuilder(0.01, 100).build("id", Arrays.asList(1, 2, 3));
        
        assertEquals(DataType.BIGINT, index.getDataType());
        assertTrue(index.contains(2L));
        assertTrue(index.contains(2.0d));
        assertTrue(index.contains("2"));
        assertFalse(index.contains(2.5d));
        assertFalse(index.contains(true));
    }
    
    @Test
    public void testMixedIntegersAndFloatsAreDouble() {
        ColumnIndex index = new ColumnIndexBuilder(0.01, 100).build("amount", Arrays.asList(1L, 2.5d, 1.0d));
        
        assertEquals(DataType.DOUBLE, index.getDataType());
        assertEquals(2, ((MembershipIndex) index).getElementCount());
        assertTrue(index.contains(1.0d));
        assertTrue(index.contains(1L));
        assertTrue(index.contains(2.5d));
        assertTrue(index.contains("1"));
        
        // 达到阈值时使用范围索引，整数与浮点数可以比较
        ColumnIndex range = new ColumnIndexBuilder(0.01, 2).build("amount", Arrays.asList(1L, 2.5d, 4L));
        assertEquals(IndexType.RANGE, range.getIndexType());
        assertEquals(DataType.DOUBLE, range.getDataType());
        assertTrue(range.contains(1.0d));
        assertTrue(range.contains(4L));
        assertTrue(range.contains(3));
        assertFalse(range.contains(4.5d));
        
        ColumnIndex declared = new ColumnIndexBuilder(0.01, 100)
                .build("amount", DataType.DOUBLE, Arrays.asList(1L, 2.5d));
        assertTrue(declared.contains(1L));
        assertTrue(declared.contains(1.0d));
    }
    
    @Test
    public void testVariantMatchesIntegralFloats() {
        ColumnIndex index = new ColumnIndexBuilder(0.01, 100).build("mixed", Arrays.asList("a", 1L, 2.5d));
        
        assertEquals(DataType.VARIANT, index.getDataType());
        assertTrue(index.contains(1.0d));
        assertTrue(index.contains(1L));
        assertTrue(index.contains(2.5d));
    }
    
    @Test
    public void testMixedValuesAreVariant() {
        ColumnIndexBuilder builder = new ColumnIndexBuilder(0.01, 3);
        ColumnIndex index = builder.build("mixed", Arrays.asList("a", 1L));
        
        assertEquals(DataType.VARIANT, index.getDataType());
        assertTrue(index.contains("a"));
        assertTrue(index.contains(1L));
        
        // 混合类型的值无法排序，不能使用范围索引
        assertThrows(InvalidColumnException.class, 
            () -> builder.build("mixed", Arrays.asList("a", 1L, true)));
    }
    
    @Test
    public void testDeclaredTypeMismatch() {
        ColumnIndexBuilder builder = new ColumnIndexBuilder(0.1, 10);
        InvalidColumnException e = assertThrows(InvalidColumnException.class, 
            () -> builder.build("id", DataType.BIGINT, Arrays.asList(1L, "two")));
        assertEquals("id", e.getColumn());
    }
    
    @Test
    public void testUnsupportedValueType() {
        ColumnIndexBuilder builder = new ColumnIndexBuilder(0.1, 10);
        assertThrows(InvalidColumnException.class, 
            () -> builder.build("c", Collections.singletonList(new Object())));
    }
    
    @Test
    public void testInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> new ColumnIndexBuilder(0.0, 10));
        assertThrows(ConfigurationException.class, () -> new ColumnIndexBuilder(1.0, 10));
        assertThrows(ConfigurationException.class, () -> new ColumnIndexBuilder(-0.5, 10));
        assertThrows(ConfigurationException.class, () -> new ColumnIndexBuilder(Double.NaN, 10));
        assertThrows(ConfigurationException.class, () -> new ColumnIndexBuilder(0.1, 0));
        assertThrows(ConfigurationException.class, () -> new ColumnIndexBuilder(0.1, -1));
    }
}
