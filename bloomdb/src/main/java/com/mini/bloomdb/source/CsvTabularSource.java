package com.mini.bloomdb.source;

import com.mini.bloomdb.exception.DataSourceException;
import com.mini.bloomdb.fs.Storage;
import com.mini.bloomdb.schema.DataType;
import com.mini.bloomdb.schema.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV 格式数据源
 * 
 * 第一行为表头，其余为数据行。支持双引号转义和引号内换行。
 * 每列的类型按 BIGINT、DOUBLE、BOOLEAN、STRING 的顺序推断，空单元格视为 null。
 */
public class CsvTabularSource implements TabularSource {
    
    private static final Logger logger = LoggerFactory.getLogger(CsvTabularSource.class);
    
    public static final char DEFAULT_DELIMITER = ',';
    public static final char DEFAULT_QUOTE = '"';
    
    private static final DataType[] INFERENCE_ORDER = {
        DataType.BIGINT, DataType.DOUBLE, DataType.BOOLEAN
    };
    
    private final String sourcePath;
    private final List<Field> fields;
    private final Map<String, List<Object>> columns;
    
    private CsvTabularSource(String sourcePath, List<Field> fields, Map<String, List<Object>> columns) {
        this.sourcePath = sourcePath;
        this.fields = Collections.unmodifiableList(fields);
        this.columns = columns;
    }
    
    /**
     * 从存储中读取 CSV 文件
     */
    public static CsvTabularSource open(Storage storage, String location) {
        byte[] content;
        try {
            content = storage.get(location);
        } catch (IOException e) {
            throw new DataSourceException("Failed to open data file " + location, e);
        }
        return read(location, new InputStreamReader(
            new ByteArrayInputStream(content), StandardCharsets.UTF_8));
    }
    
    public static CsvTabularSource read(String sourcePath, Reader reader) {
        return read(sourcePath, reader, DEFAULT_DELIMITER, DEFAULT_QUOTE);
    }
    
    /**
     * 读取全部数据并推断列类型，读取完成后关闭 reader
     */
    public static CsvTabularSource read(String sourcePath, Reader reader, char delimiter, char quote) {
        List<String> header;
        List<List<String>> rawColumns = new ArrayList<>();
        
        try (RecordParser parser = new RecordParser(reader, delimiter, quote)) {
            header = parser.next();
            if (header == null) {
                throw new DataSourceException("Data file " + sourcePath + " has no header row");
            }
            if (!header.isEmpty() && header.get(0).startsWith("\uFEFF")) {
                header.set(0, header.get(0).substring(1));
            }
            
            Map<String, Integer> seen = new HashMap<>();
            for (int i = 0; i < header.size(); i++) {
                String name = header.get(i).trim();
                if (name.isEmpty()) {
                    throw new DataSourceException(String.format(
                        "Data file %s has an empty column name at position %d", sourcePath, i + 1));
                }
                if (seen.put(name, i) != null) {
                    throw new DataSourceException(String.format(
                        "Data file %s has duplicate column '%s'", sourcePath, name));
                }
                header.set(i, name);
                rawColumns.add(new ArrayList<>());
            }
            
            List<String> record;
            while ((record = parser.next()) != null) {
                if (record.size() == 1 && record.get(0).isEmpty()) {
                    // 空行
                    continue;
                }
                if (record.size() != header.size()) {
                    throw new DataSourceException(String.format(
                        "CSV column count mismatch in %s at line %d: expected %d, got %d", 
                        sourcePath, parser.getLineNumber(), header.size(), record.size()));
                }
                for (int i = 0; i < record.size(); i++) {
                    String cell = record.get(i);
                    rawColumns.get(i).add(cell.isEmpty() ? null : cell);
                }
            }
        } catch (IOException e) {
            throw new DataSourceException("Failed to parse data file " + sourcePath, e);
        }
        
        List<Field> fields = new ArrayList<>(header.size());
        Map<String, List<Object>> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            List<String> raw = rawColumns.get(i);
            DataType type = inferType(raw);
            List<Object> values = new ArrayList<>(raw.size());
            for (String cell : raw) {
                values.add(cell == null ? null : type.parse(cell));
            }
            fields.add(new Field(header.get(i), type));
            columns.put(header.get(i), Collections.unmodifiableList(values));
        }
        
        logger.debug("Read {} columns and {} rows from {}", 
                    fields.size(), rawColumns.isEmpty() ? 0 : rawColumns.get(0).size(), sourcePath);
        
        return new CsvTabularSource(sourcePath, fields, columns);
    }
    
    /**
     * 推断列类型，所有非空值都能解析时才选用该类型
     */
    static DataType inferType(List<String> cells) {
        for (DataType candidate : INFERENCE_ORDER) {
            boolean allAccepted = true;
            boolean anyValue = false;
            for (String cell : cells) {
                if (cell == null) {
                    continue;
                }
                anyValue = true;
                if (!candidate.accepts(cell)) {
                    allAccepted = false;
                    break;
                }
            }
            if (!anyValue) {
                return DataType.STRING;
            }
            if (allAccepted) {
                return candidate;
            }
        }
        return DataType.STRING;
    }
    
    @Override
    public String getSourcePath() {
        return sourcePath;
    }
    
    @Override
    public List<Field> getFields() {
        return fields;
    }
    
    @Override
    public List<Object> columnValues(String column) {
        List<Object> values = columns.get(column);
        if (values == null) {
            throw new DataSourceException("Column " + column + " not found in " + sourcePath);
        }
        return values;
    }
    
    /**
     * CSV 记录解析器
     * 处理引号、双引号转义以及引号内的换行
     */
    private static class RecordParser implements AutoCloseable {
        private final Reader reader;
        private final char delimiter;
        private final char quote;
        private int lineNumber = 0;
        private int pushback = -2;
        
        RecordParser(Reader reader, char delimiter, char quote) {
            this.reader = reader;
            this.delimiter = delimiter;
            this.quote = quote;
        }
        
        int getLineNumber() {
            return lineNumber;
        }
        
        private int read() throws IOException {
            if (pushback != -2) {
                int c = pushback;
                pushback = -2;
                return c;
            }
            return reader.read();
        }
        
        /**
         * 读取下一条记录
         * @return 字段列表，到达文件末尾返回 null
         */
        List<String> next() throws IOException {
            int c = read();
            if (c == -1) {
                return null;
            }
            lineNumber++;
            
            List<String> values = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            boolean inQuotes = false;
            
            while (true) {
                if (c == -1) {
                    if (inQuotes) {
                        throw new IOException("Unterminated quoted field at line " + lineNumber);
                    }
                    break;
                }
                char ch = (char) c;
                if (inQuotes) {
                    if (ch == quote) {
                        int next = read();
                        if (next == quote) {
                            // 双引号转义
                            current.append(quote);
                        } else {
                            inQuotes = false;
                            pushback = next;
                        }
                    } else {
                        if (ch == '\n') {
                            lineNumber++;
                        }
                        current.append(ch);
                    }
                } else if (ch == quote && current.length() == 0) {
                    inQuotes = true;
                } else if (ch == delimiter) {
                    values.add(current.toString());
                    current.setLength(0);
                } else if (ch == '\r') {
                    int next = read();
                    if (next != '\n') {
                        pushback = next;
                    }
                    break;
                } else if (ch == '\n') {
                    break;
                } else {
                    current.append(ch);
                }
                c = read();
            }
            
            values.add(current.toString());
            return values;
        }
        
        @Override
        public void close() throws IOException {
            reader.close();
        }
    }
}
