package com.mini.bloomdb.source;

import com.mini.bloomdb.exception.DataSourceException;
import com.mini.bloomdb.exception.InvalidColumnException;
import com.mini.bloomdb.fs.Storage;
import com.mini.bloomdb.schema.DataType;
import com.mini.bloomdb.schema.Field;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.DelegatingSeekableInputStream;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.io.SeekableInputStream;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parquet 格式数据源
 *
 * 只读取顶层的基本类型列：INT32/INT64 为 BIGINT，FLOAT/DOUBLE 和 DECIMAL 为 DOUBLE，
 * BOOLEAN 为 BOOLEAN，BINARY 按 UTF-8 读为 STRING。
 * 嵌套列和其他物理类型无法建立索引，读取这些列时抛出 {@link InvalidColumnException}。
 */
public class ParquetTabularSource implements TabularSource {

    private static final Logger logger = LoggerFactory.getLogger(ParquetTabularSource.class);

    private final String sourcePath;
    private final List<Field> fields;
    private final Map<String, List<Object>> columns;

    /** 列名 -> 无法索引的原因 */
    private final Map<String, String> unsupported;

    private ParquetTabularSource(String sourcePath, List<Field> fields,
                                 Map<String, List<Object>> columns, Map<String, String> unsupported) {
        this.sourcePath = sourcePath;
        this.fields = Collections.unmodifiableList(fields);
        this.columns = columns;
        this.unsupported = unsupported;
    }

    /**
     * 从存储中读取 Parquet 文件
     */
    public static ParquetTabularSource open(Storage storage, String location) {
        byte[] content;
        try {
            content = storage.get(location);
        } catch (IOException e) {
            throw new DataSourceException("Failed to open data file " + location, e);
        }
        return read(location, content);
    }

    /**
     * 读取全部行组
     * @throws DataSourceException 不是合法的 Parquet 文件
     */
    public static ParquetTabularSource read(String sourcePath, byte[] content) {
        try (ParquetFileReader reader = ParquetFileReader.open(new ByteArrayInputFile(content))) {
            MessageType schema = reader.getFileMetaData().getSchema();

            List<Field> fields = new ArrayList<>();
            Map<String, List<Object>> columns = new HashMap<>();
            Map<String, String> unsupported = new HashMap<>();
            List<Type> schemaFields = schema.getFields();
            DataType[] types = new DataType[schemaFields.size()];

            for (int i = 0; i < schemaFields.size(); i++) {
                Type field = schemaFields.get(i);
                String reason = unsupportedReason(field);
                if (reason != null) {
                    unsupported.put(field.getName(), reason);
                    fields.add(new Field(field.getName(), DataType.VARIANT));
                } else {
                    types[i] = mapType(field.asPrimitiveType());
                    fields.add(new Field(field.getName(), types[i]));
                    columns.put(field.getName(), new ArrayList<>());
                }
            }

            MessageColumnIO columnIO = new ColumnIOFactory().getColumnIO(schema);
            long rows = 0;
            PageReadStore rowGroup;
            while ((rowGroup = reader.readNextRowGroup()) != null) {
                RecordReader<Group> records = columnIO.getRecordReader(rowGroup, new GroupRecordConverter(schema));
                for (long r = 0; r < rowGroup.getRowCount(); r++) {
                    Group record = records.read();
                    for (int i = 0; i < schemaFields.size(); i++) {
                        if (types[i] != null) {
                            readField(record, i, schemaFields.get(i).asPrimitiveType(),
                                      columns.get(schemaFields.get(i).getName()));
                        }
                    }
                }
                rows += rowGroup.getRowCount();
            }

            for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
                entry.setValue(Collections.unmodifiableList(entry.getValue()));
            }
            logger.debug("Read {} columns and {} rows from {}", fields.size(), rows, sourcePath);
            return new ParquetTabularSource(sourcePath, fields, columns, unsupported);
        } catch (IOException | RuntimeException e) {
            throw new DataSourceException("Failed to parse data file " + sourcePath + ": " + e.getMessage(), e);
        }
    }

    private static String unsupportedReason(Type field) {
        if (!field.isPrimitive()) {
            return "nested column is not supported";
        }
        PrimitiveType primitive = field.asPrimitiveType();
        if (primitive.getLogicalTypeAnnotation() instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) {
            return null;
        }
        switch (primitive.getPrimitiveTypeName()) {
            case INT96:
            case FIXED_LEN_BYTE_ARRAY:
                return "physical type " + primitive.getPrimitiveTypeName() + " is not supported";
            default:
                return null;
        }
    }

    private static DataType mapType(PrimitiveType primitive) {
        if (primitive.getLogicalTypeAnnotation() instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) {
            return DataType.DOUBLE;
        }
        switch (primitive.getPrimitiveTypeName()) {
            case INT32:
            case INT64:
                return DataType.BIGINT;
            case FLOAT:
            case DOUBLE:
                return DataType.DOUBLE;
            case BOOLEAN:
                return DataType.BOOLEAN;
            default:
                return DataType.STRING;
        }
    }

    /**
     * 读取一个字段的全部值；可选字段缺失时记为 null，重复字段的每个元素各记一个值
     */
    private static void readField(Group record, int fieldIndex, PrimitiveType primitive, List<Object> values) {
        int count = record.getFieldRepetitionCount(fieldIndex);
        if (count == 0) {
            values.add(null);
            return;
        }
        for (int j = 0; j < count; j++) {
            values.add(DataType.normalize(readValue(record, fieldIndex, j, primitive)));
        }
    }

    private static Object readValue(Group record, int fieldIndex, int index, PrimitiveType primitive) {
        LogicalTypeAnnotation annotation = primitive.getLogicalTypeAnnotation();
        if (annotation instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) {
            int scale = ((LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) annotation).getScale();
            BigInteger unscaled;
            switch (primitive.getPrimitiveTypeName()) {
                case INT32:
                    unscaled = BigInteger.valueOf(record.getInteger(fieldIndex, index));
                    break;
                case INT64:
                    unscaled = BigInteger.valueOf(record.getLong(fieldIndex, index));
                    break;
                default:
                    unscaled = new BigInteger(record.getBinary(fieldIndex, index).getBytes());
                    break;
            }
            return new BigDecimal(unscaled, scale).doubleValue();
        }
        switch (primitive.getPrimitiveTypeName()) {
            case INT32:
                return record.getInteger(fieldIndex, index);
            case INT64:
                return record.getLong(fieldIndex, index);
            case FLOAT:
                return (double) record.getFloat(fieldIndex, index);
            case DOUBLE:
                return record.getDouble(fieldIndex, index);
            case BOOLEAN:
                return record.getBoolean(fieldIndex, index);
            default:
                return record.getBinary(fieldIndex, index).toStringUsingUTF8();
        }
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
        String reason = unsupported.get(column);
        if (reason != null) {
            throw new InvalidColumnException(column, reason);
        }
        List<Object> values = columns.get(column);
        if (values == null) {
            throw new DataSourceException("Column " + column + " not found in " + sourcePath);
        }
        return values;
    }

    /**
     * 内存中的 Parquet 文件，数据已经从存储整体读出
     */
    private static class ByteArrayInputFile implements InputFile {
        private final byte[] content;

        ByteArrayInputFile(byte[] content) {
            this.content = content;
        }

        @Override
        public long getLength() {
            return content.length;
        }

        @Override
        public SeekableInputStream newStream() {
            SeekableByteArrayInputStream in = new SeekableByteArrayInputStream(content);
            return new DelegatingSeekableInputStream(in) {
                @Override
                public long getPos() {
                    return in.getPos();
                }

                @Override
                public void seek(long newPos) throws IOException {
                    in.seek(newPos);
                }
            };
        }
    }

    private static class SeekableByteArrayInputStream extends ByteArrayInputStream {

        SeekableByteArrayInputStream(byte[] buf) {
            super(buf);
        }

        long getPos() {
            return pos;
        }

        void seek(long newPos) throws IOException {
            if (newPos < 0 || newPos > count) {
                throw new EOFException("Seek position " + newPos + " is outside [0, " + count + "]");
            }
            pos = (int) newPos;
        }
    }
}
