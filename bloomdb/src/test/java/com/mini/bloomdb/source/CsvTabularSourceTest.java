package com.mini.bloomdb.source;

import com.mini.bloomdb.exception.DataSourceException;
import com.mini.bloomdb.fs.LocalStorage;
import com.mini.bloomdb.schema.DataType;
import com.mini.bloomdb.schema.Field;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CSV 数据源解析与类型推断测试
 */
public class CsvTabularSourceTest {
    
    @TempDir
    Path tempDir;
    
    private static CsvTabularSource read(String csv) {
        return CsvTabularSource.read("test.csv", new StringReader(csv));
    }
    
    @Test
    public void testInferTypes() {
        CsvTabularSource source = read(
            "id,score,active,name\n" +
            "1,1.5,true,Alice\n" +
            "2,2,false,Bob\n");
        
        assertEquals(Arrays.asList(
            new Field("id", DataType.BIGINT),
            new Field("score", DataType.DOUBLE),
            new Field("active", DataType.BOOLEAN),
            new Field("name", DataType.STRING)
        ), source.getFields());
        
        assertEquals(Arrays.asList(1L, 2L), source.columnValues("id"));
        assertEquals(Arrays.asList(1.5d, 2.0d), source.columnValues("score"));
        assertEquals(Arrays.asList(true, false), source.columnValues("active"));
        assertEquals(Arrays.asList("Alice", "Bob"), source.columnValues("name"));
    }
    
    @Test
    public void testEmptyCellsAreNull() {
        CsvTabularSource source = read("a,b\n1,\n,x\n");
        
        assertEquals(Arrays.asList(1L, null), source.columnValues("a"));
        assertEquals(Arrays.asList(null, "x"), source.columnValues("b"));
        
        // 全空的列按字符串处理
        CsvTabularSource allEmpty = read("a,b\n1,\n2,\n");
        assertEquals(DataType.STRING, allEmpty.getFields().get(1).getType());
    }
    
    @Test
    public void testQuotedFields() {
        CsvTabularSource source = read(
            "name,comment\r\n" +
            "\"Smith, John\",\"said \"\"hi\"\"\"\r\n" +
            "Jane,\"line1\nline2\"\r\n");
        
        assertEquals(Arrays.asList("Smith, John", "Jane"), source.columnValues("name"));
        assertEquals(Arrays.asList("said \"hi\"", "line1\nline2"), source.columnValues("comment"));
    }
    
    @Test
    public void testByteOrderMarkIsStripped() {
        CsvTabularSource source = read("\uFEFFaccount_status\nActive\n");
        assertEquals("account_status", source.getFields().get(0).getName());
    }
    
    @Test
    public void testCustomDelimiter() {
        CsvTabularSource source = CsvTabularSource.read("t.tsv", new StringReader("a\tb\n1\t2\n"), '\t', '"');
        assertEquals(Collections.singletonList(2L), source.columnValues("b"));
    }
    
    @Test
    public void testMalformedFiles() {
        assertThrows(DataSourceException.class, () -> read(""));
        assertThrows(DataSourceException.class, () -> read("a,a\n1,2\n"));
        assertThrows(DataSourceException.class, () -> read("a,,c\n1,2,3\n"));
        assertThrows(DataSourceException.class, () -> read("a,b\n1,2,3\n"));
        assertThrows(DataSourceException.class, () -> read("a\n1\n").columnValues("missing"));
    }
    
    @Test
    public void testOpenFromStorage() throws Exception {
        Path file = tempDir.resolve("data.csv");
        Files.write(file, "city\nSydney\nPerth\n".getBytes(StandardCharsets.UTF_8));
        
        CsvTabularSource source = CsvTabularSource.open(new LocalStorage(), file.toString());
        assertEquals(file.toString(), source.getSourcePath());
        assertEquals(Arrays.asList("Sydney", "Perth"), source.columnValues("city"));
        
        assertThrows(DataSourceException.class, 
            () -> CsvTabularSource.open(new LocalStorage(), tempDir.resolve("missing.csv").toString()));
    }
}
