package com.mini.bloomdb.fs;

import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Amazon S3 对象存储
 * 位置格式为 s3://bucket/key，目录只是以 / 结尾的 key 前缀
 */
public class S3Storage implements Storage {
    
    private static final String PREFIX = "s3://";
    
    private final S3Client client;
    
    public S3Storage(S3Client client) {
        this.client = requireNonNull(client, "client is null");
    }
    
    @Override
    public Scheme getScheme() {
        return Scheme.s3;
    }
    
    @Override
    public byte[] get(String location) throws IOException {
        ObjectPath path = ObjectPath.parse(location);
        if (path.key == null) {
            throw new IOException("Location " + location + " is a bucket, not an object");
        }
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                    .bucket(path.bucket).key(path.key).build();
            ResponseBytes<GetObjectResponse> response = client.getObjectAsBytes(request);
            return response.asByteArray();
        } catch (NoSuchKeyException e) {
            throw new NoSuchFileException(location);
        } catch (SdkException e) {
            throw new IOException("Failed to get " + location, e);
        }
    }
    
    @Override
    public void put(String location, byte[] data) throws IOException {
        ObjectPath path = ObjectPath.parse(location);
        if (path.key == null) {
            throw new IOException("Location " + location + " is a bucket, not an object");
        }
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(path.bucket).key(path.key).build();
            client.putObject(request, RequestBody.fromBytes(data));
        } catch (SdkException e) {
            throw new IOException("Failed to put " + location, e);
        }
    }
    
    /**
     * S3 没有真正的目录，不存在的前缀返回空列表
     */
    @Override
    public List<String> list(String prefix, FileNamePattern pattern) throws IOException {
        ObjectPath path = ObjectPath.parse(prefix);
        String keyPrefix = path.key == null ? "" : 
                (path.key.endsWith("/") ? path.key : path.key + "/");
        
        List<String> names = new ArrayList<>();
        try {
            ListObjectsV2Request.Builder builder = ListObjectsV2Request.builder()
                    .bucket(path.bucket).prefix(keyPrefix).delimiter("/");
            ListObjectsV2Response response = client.listObjectsV2(builder.build());
            while (true) {
                for (S3Object object : response.contents()) {
                    String name = object.key().substring(keyPrefix.length());
                    if (!name.isEmpty() && pattern.matches(name)) {
                        names.add(name);
                    }
                }
                if (!Boolean.TRUE.equals(response.isTruncated())) {
                    break;
                }
                response = client.listObjectsV2(
                    builder.continuationToken(response.nextContinuationToken()).build());
            }
        } catch (SdkException e) {
            throw new IOException("Failed to list " + prefix, e);
        }
        Collections.sort(names);
        
        List<String> locations = new ArrayList<>(names.size());
        for (String name : names) {
            locations.add(join(prefix, name));
        }
        return locations;
    }
    
    @Override
    public boolean exists(String location) throws IOException {
        ObjectPath path = ObjectPath.parse(location);
        if (path.key == null) {
            return true;
        }
        try {
            client.headObject(HeadObjectRequest.builder().bucket(path.bucket).key(path.key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new IOException("Failed to check " + location, e);
        } catch (SdkException e) {
            throw new IOException("Failed to check " + location, e);
        }
    }
    
    /**
     * 对象存储路径：bucket + key
     */
    static final class ObjectPath {
        final String bucket;
        final String key;
        
        private ObjectPath(String bucket, String key) {
            this.bucket = bucket;
            this.key = key;
        }
        
        /**
         * @throws IllegalArgumentException 不是合法的 s3 位置
         */
        static ObjectPath parse(String location) {
            requireNonNull(location, "location is null");
            String path = location.startsWith(PREFIX) ? location.substring(PREFIX.length()) : location;
            int slash = path.indexOf('/');
            if (slash == 0 || path.isEmpty()) {
                throw new IllegalArgumentException("Location '" + location + "' has no bucket");
            }
            if (slash < 0) {
                return new ObjectPath(path, null);
            }
            String key = path.substring(slash + 1);
            return new ObjectPath(path.substring(0, slash), key.isEmpty() ? null : key);
        }
    }
}
