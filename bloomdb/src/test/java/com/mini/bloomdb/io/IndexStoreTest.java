package com.mini.bloomdb.io;

import com.mini.bloomdb.exception.StoreException.StoreReadException;
import com.mini.bloomdb.exception.StoreException.StoreVersionMismatchException;
import com.mini.bloomdb.exception.StoreException.StoreWriteException;
import com.mini.bloomdb.fs.FileNamePattern;
import com.mini.bloomdb.index.FileIndex;
import com.mini.bloomdb.index.FileIndexBuilder;
import com.mini.bloomdb.index.FileIndexSerializer;
import com.mini.bloomdb.index.IndexOptions;
import com.mini.bloomdb.schema.DataType;
import com.mini.bloomdb.source.ListTabularSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 索引存储读写测试
 */
public class IndexStoreTest {
    
    @TempDir
    Path tempDir;
    
    private final IndexStore store = new IndexStore();
    
    private static FileIndex index(String sourcePath, String... statuses) {
        return new FileIndexBuilder(new IndexOptions())
                .build(ListTabularSource.builder(sourcePath)
                        .column("account_status", DataType.STRING, (Object[]) statuses)
                        .build())
                .getFileIndex();
    }
    
    @Test
    public void testWriteAndRead() {
        String location = tempDir.resolve("idx/a.csv.bidx").toString();
        int size = store.write(index("/data/a.csv", "Active"), location);
        
        assertTrue(size > 0);
        FileIndex loaded = store.read(location);
        assertEquals("/data/a.csv", loaded.getSourcePath());
        assertTrue(loaded.getColumnIndex("account_status").contains("Active"));
        
        // 再次写入整体覆盖
        store.write(index("/data/a.csv", "Inactive"), location);
        assertTrue(store.read(location).getColumnIndex("account_status").contains("Inactive"));
    }
    
    @Test
    public void testFileUriLocation() {
        String location = "file://" + tempDir.resolve("b.csv.bidx");
        store.write(index("b.csv", "x"), location);
        assertEquals("b.csv", store.read(location).getSourcePath());
    }
    
    @Test
    public void testReadMissing() {
        StoreReadException e = assertThrows(StoreReadException.class, 
            () -> store.read(tempDir.resolve("missing.bidx").toString()));
        assertTrue(e.getMessage().contains("not found"));
    }
    
    @Test
    public void testReadCorrupt() throws Exception {
        Path path = tempDir.resolve("corrupt.bidx");
        Files.write(path, new byte[]{1, 2, 3, 4, 5, 6, 7, 8});
        assertThrows(StoreReadException.class, () -> store.read(path.toString()));
    }
    
    @Test
    public void testReadVersionMismatch() throws Exception {
        byte[] data = FileIndexSerializer.serialize(index("c.csv", "x"));
        ByteBuffer.wrap(data).putShort(4, (short) 99);
        Path path = tempDir.resolve("future.bidx");
        Files.write(path, data);
        
        assertThrows(StoreVersionMismatchException.class, () -> store.read(path.toString()));
    }
    
    @Test
    public void testWriteFailure() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.write(blocker, new byte[]{0});
        
        // 父目录是普通文件，无法写入
        assertThrows(StoreWriteException.class, 
            () -> store.write(index("d.csv", "x"), blocker.resolve("d.csv.bidx").toString()));
    }
    
    @Test
    public void testListByPattern() throws Exception {
        for (String name : new String[]{"APAC_AUS_1.csv", "APAC_AUS_2.csv", "EMEA_UK_1.csv"}) {
            store.write(index(name, "x"), tempDir.resolve(name + ".bidx").toString());
        }
        Files.write(tempDir.resolve("README.md"), new byte[]{1});
        
        assertEquals(Arrays.asList(
            tempDir.resolve("APAC_AUS_1.csv.bidx").toString(),
            tempDir.resolve("APAC_AUS_2.csv.bidx").toString()
        ), store.list(tempDir.toString(), new FileNamePattern("APAC_*.csv")));
        
        assertEquals(3, store.list(tempDir.toString(), FileNamePattern.ALL).size());
        assertEquals(Collections.emptyList(), store.list(tempDir.toString(), new FileNamePattern("*.parquet")));
        
        assertThrows(StoreReadException.class, 
            () -> store.list(tempDir.resolve("nope").toString(), FileNamePattern.ALL));
    }
}
