package com.mini.bloomdb.schema;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DataType 规范化与类型转换测试
 */
public class DataTypeTest {
    
    @Test
    public void testNormalize() {
        assertEquals(5L, DataType.normalize(5));
        assertEquals(5L, DataType.normalize((short) 5));
        assertEquals(1.5d, DataType.normalize(1.5f));
        assertEquals(0.0d, DataType.normalize(-0.0d));
        assertEquals(7L, DataType.normalize(BigInteger.valueOf(7)));
        assertEquals(2L, DataType.normalize(new BigDecimal("2.0")));
        assertEquals(2.5d, DataType.normalize(new BigDecimal("2.5")));
        assertEquals("x", DataType.normalize('x'));
        assertNull(DataType.normalize(null));
        
        assertThrows(IllegalArgumentException.class, () -> DataType.normalize(new Object()));
    }
    
    @Test
    public void testCoerceToBigint() {
        assertEquals(Optional.of(42L), DataType.BIGINT.coerce(42));
        assertEquals(Optional.of(42L), DataType.BIGINT.coerce(42.0d));
        assertEquals(Optional.of(42L), DataType.BIGINT.coerce("42"));
        assertEquals(Optional.of(42L), DataType.BIGINT.coerce("42.0"));
        
        // 非整数或不可解析的值不可能出现在整数列中
        assertFalse(DataType.BIGINT.coerce(42.5d).isPresent());
        assertFalse(DataType.BIGINT.coerce("abc").isPresent());
        assertFalse(DataType.BIGINT.coerce(true).isPresent());
        assertFalse(DataType.BIGINT.coerce(1e19).isPresent());
    }
    
    @Test
    public void testCoerceToOtherTypes() {
        assertEquals(Optional.of(3.0d), DataType.DOUBLE.coerce(3));
        assertEquals(Optional.of(3.25d), DataType.DOUBLE.coerce("3.25"));
        assertFalse(DataType.DOUBLE.coerce("three").isPresent());
        
        assertEquals(Optional.of(true), DataType.BOOLEAN.coerce("TRUE"));
        assertFalse(DataType.BOOLEAN.coerce(1).isPresent());
        
        assertEquals(Optional.of("Active"), DataType.STRING.coerce("Active"));
        assertEquals(Optional.of("5"), DataType.STRING.coerce(5));
        
        assertEquals(Optional.of(5L), DataType.VARIANT.coerce(5));
    }
    
    @Test
    public void testTypeOfAndFromName() {
        assertEquals(DataType.BIGINT, DataType.typeOf(1L));
        assertEquals(DataType.DOUBLE, DataType.typeOf(1.0d));
        assertEquals(DataType.BOOLEAN, DataType.typeOf(false));
        assertEquals(DataType.STRING, DataType.typeOf("a"));
        
        assertEquals(DataType.STRING, DataType.fromName("string"));
        assertThrows(IllegalArgumentException.class, () -> DataType.fromName("DATE"));
        
        assertTrue(DataType.STRING.isComparable());
        assertFalse(DataType.VARIANT.isComparable());
    }
}
