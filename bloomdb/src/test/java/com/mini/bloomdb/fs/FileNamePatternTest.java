package com.mini.bloomdb.fs;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 文件名通配符测试
 */
public class FileNamePatternTest {
    
    @Test
    public void testGlob() {
        FileNamePattern pattern = new FileNamePattern("APAC_*.csv");
        assertTrue(pattern.matches("APAC_AUS_1.csv"));
        assertFalse(pattern.matches("EMEA_UK_1.csv"));
        assertFalse(pattern.matches("APAC_AUS_1.csv.bak"));
        
        assertTrue(new FileNamePattern("file_?.csv").matches("file_1.csv"));
        assertFalse(new FileNamePattern("file_?.csv").matches("file_10.csv"));
        assertTrue(new FileNamePattern("*.{csv,tsv}").matches("a.tsv"));
        assertTrue(FileNamePattern.ALL.matches("anything"));
    }
    
    @Test
    public void testMapNames() {
        FileNamePattern pattern = new FileNamePattern("*.csv")
                .mapNames(name -> name.endsWith(".bidx") ? name.substring(0, name.length() - 5) : null);
        
        assertTrue(pattern.matches("a.csv.bidx"));
        assertFalse(pattern.matches("a.csv"));
        assertEquals("*.csv", pattern.getGlob());
    }
    
    @Test
    public void testInvalidGlob() {
        assertThrows(IllegalArgumentException.class, () -> new FileNamePattern(""));
        assertThrows(IllegalArgumentException.class, () -> new FileNamePattern("[abc"));
    }
}
