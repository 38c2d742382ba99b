package com.mini.bloomdb.index;

import com.mini.bloomdb.exception.StoreException.StoreReadException;
import com.mini.bloomdb.exception.StoreException.StoreVersionMismatchException;
import com.mini.bloomdb.schema.DataType;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 文件索引的二进制序列化格式
 * 
 * 格式（大端序）：
 * <pre>
 * int    magic "BLMI"
 * short  version
 * string sourcePath
 * long   createdAt
 * double errorRate
 * int    rangeFilterThreshold
 * int    columnCount
 *   string name, string dataType, byte indexType, payload
 * int    unindexedCount
 *   string column
 * </pre>
 * 字符串编码为 int 长度 + UTF-8 字节。
 */
public final class FileIndexSerializer {
    
    public static final int MAGIC = 0x424C4D49;
    public static final int VERSION = 1;
    
    private FileIndexSerializer() {
    }
    
    public static byte[] serialize(FileIndex fileIndex) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        DataOutputStream dos = new DataOutputStream(baos);
        
        dos.writeInt(MAGIC);
        dos.writeShort(VERSION);
        writeString(dos, fileIndex.getSourcePath());
        dos.writeLong(fileIndex.getCreatedAt());
        dos.writeDouble(fileIndex.getErrorRate());
        dos.writeInt(fileIndex.getRangeFilterThreshold());
        
        dos.writeInt(fileIndex.getColumns().size());
        for (ColumnIndex index : fileIndex.getColumns().values()) {
            writeString(dos, index.getColumn());
            writeString(dos, index.getDataType().name());
            dos.writeByte(index.getIndexType().getCode());
            
            switch (index.getIndexType()) {
                case MEMBERSHIP:
                    writeMembership(dos, (MembershipIndex) index);
                    break;
                case RANGE:
                    RangeIndex range = (RangeIndex) index;
                    writeValue(dos, range.getDataType(), range.getMinValue());
                    writeValue(dos, range.getDataType(), range.getMaxValue());
                    break;
                default:
                    throw new IOException("Unsupported index type: " + index.getIndexType());
            }
        }
        
        dos.writeInt(fileIndex.getUnindexedColumns().size());
        for (String column : fileIndex.getUnindexedColumns()) {
            writeString(dos, column);
        }
        
        dos.flush();
        return baos.toByteArray();
    }
    
    /**
     * @param location 数据来源位置，仅用于错误信息
     * @throws StoreVersionMismatchException 格式版本不兼容
     * @throws StoreReadException 数据损坏
     */
    public static FileIndex deserialize(String location, byte[] data) {
        DataInputStream dis = new DataInputStream(new ByteArrayInputStream(data));
        try {
            if (data.length < 6 || dis.readInt() != MAGIC) {
                throw new StoreReadException(location, "not an index file");
            }
            int version = dis.readUnsignedShort();
            if (version != VERSION) {
                throw new StoreVersionMismatchException(location, VERSION, version);
            }
            
            String sourcePath = readString(dis);
            long createdAt = dis.readLong();
            double errorRate = dis.readDouble();
            int threshold = dis.readInt();
            
            int columnCount = readCount(dis);
            Map<String, ColumnIndex> columns = new LinkedHashMap<>();
            for (int i = 0; i < columnCount; i++) {
                String name = readString(dis);
                DataType dataType = DataType.fromName(readString(dis));
                IndexType indexType = IndexType.fromCode(dis.readByte());
                
                ColumnIndex index;
                switch (indexType) {
                    case MEMBERSHIP:
                        index = readMembership(dis, name, dataType);
                        break;
                    case RANGE:
                        if (!dataType.isComparable()) {
                            throw new IOException("Range index on non-comparable type " + dataType);
                        }
                        index = new RangeIndex(name, dataType, 
                            readValue(dis, dataType), readValue(dis, dataType));
                        break;
                    default:
                        throw new IOException("Unsupported index type: " + indexType);
                }
                if (columns.put(name, index) != null) {
                    throw new IOException("Duplicate column " + name);
                }
            }
            
            int unindexedCount = readCount(dis);
            Set<String> unindexed = new LinkedHashSet<>();
            for (int i = 0; i < unindexedCount; i++) {
                unindexed.add(readString(dis));
            }
            
            if (dis.available() > 0) {
                throw new IOException(dis.available() + " trailing bytes");
            }
            
            return new FileIndex(sourcePath, columns, unindexed, errorRate, threshold, createdAt);
        } catch (StoreReadException e) {
            throw e;
        } catch (EOFException e) {
            throw new StoreReadException(location, "truncated index data", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new StoreReadException(location, "corrupt index data: " + e.getMessage(), e);
        }
    }
    
    private static void writeMembership(DataOutputStream dos, MembershipIndex index) throws IOException {
        ByteArrayOutputStream filterBytes = new ByteArrayOutputStream();
        index.writeTo(filterBytes);
        dos.writeInt(index.getElementCount());
        dos.writeInt(filterBytes.size());
        filterBytes.writeTo(dos);
    }
    
    private static MembershipIndex readMembership(DataInputStream dis, String name, DataType dataType) 
            throws IOException {
        int elementCount = dis.readInt();
        if (elementCount < 0) {
            throw new IOException("Negative element count " + elementCount);
        }
        byte[] filterBytes = new byte[readLength(dis)];
        dis.readFully(filterBytes);
        return MembershipIndex.readFrom(name, dataType, elementCount, 
            new ByteArrayInputStream(filterBytes));
    }
    
    private static void writeValue(DataOutputStream dos, DataType type, Object value) throws IOException {
        switch (type) {
            case BIGINT:
                dos.writeLong((Long) value);
                break;
            case DOUBLE:
                dos.writeDouble((Double) value);
                break;
            case BOOLEAN:
                dos.writeBoolean((Boolean) value);
                break;
            case STRING:
                writeString(dos, (String) value);
                break;
            default:
                throw new IOException("Cannot write range bound of type " + type);
        }
    }
    
    @SuppressWarnings("rawtypes")
    private static Comparable readValue(DataInputStream dis, DataType type) throws IOException {
        switch (type) {
            case BIGINT:
                return dis.readLong();
            case DOUBLE:
                return dis.readDouble();
            case BOOLEAN:
                return dis.readBoolean();
            case STRING:
                return readString(dis);
            default:
                throw new IOException("Cannot read range bound of type " + type);
        }
    }
    
    private static void writeString(DataOutputStream dos, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        dos.writeInt(bytes.length);
        dos.write(bytes);
    }
    
    private static String readString(DataInputStream dis) throws IOException {
        byte[] bytes = new byte[readLength(dis)];
        dis.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
    
    /**
     * 读取长度字段，长度不能超过剩余字节数
     */
    private static int readLength(DataInputStream dis) throws IOException {
        int length = dis.readInt();
        if (length < 0 || length > dis.available()) {
            throw new IOException("Invalid length " + length);
        }
        return length;
    }
    
    private static int readCount(DataInputStream dis) throws IOException {
        int count = dis.readInt();
        if (count < 0 || count > dis.available()) {
            throw new IOException("Invalid count " + count);
        }
        return count;
    }
}
