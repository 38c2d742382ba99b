package com.mini.bloomdb.fs;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * S3 位置解析测试
 */
public class S3StorageTest {
    
    @Test
    public void testParseObjectPath() {
        S3Storage.ObjectPath path = S3Storage.ObjectPath.parse("s3://bucket/indexes/a.csv.bidx");
        assertEquals("bucket", path.bucket);
        assertEquals("indexes/a.csv.bidx", path.key);
        
        S3Storage.ObjectPath bucketOnly = S3Storage.ObjectPath.parse("s3://bucket/");
        assertEquals("bucket", bucketOnly.bucket);
        assertNull(bucketOnly.key);
        
        assertNull(S3Storage.ObjectPath.parse("s3://bucket").key);
    }
    
    @Test
    public void testParseInvalid() {
        assertThrows(IllegalArgumentException.class, () -> S3Storage.ObjectPath.parse("s3://"));
        assertThrows(IllegalArgumentException.class, () -> S3Storage.ObjectPath.parse("s3:///key"));
    }
}
