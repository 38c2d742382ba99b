package com.mini.bloomdb.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * 本地文件系统存储
 * 支持普通路径和 file:// 前缀的路径
 */
public class LocalStorage implements Storage {
    
    private static final String PREFIX = "file://";
    
    @Override
    public Scheme getScheme() {
        return Scheme.file;
    }
    
    @Override
    public byte[] get(String location) throws IOException {
        return Files.readAllBytes(toPath(location));
    }
    
    /**
     * 先写临时文件再原子替换，读者不会看到写了一半的内容
     */
    @Override
    public void put(String location, byte[] data) throws IOException {
        Path path = toPath(location);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = Files.createTempFile(parent, "." + path.getFileName(), ".tmp");
        try {
            Files.write(tmp, data);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
    
    @Override
    public List<String> list(String prefix, FileNamePattern pattern) throws IOException {
        Path dir = toPath(prefix);
        if (!Files.exists(dir)) {
            throw new NoSuchFileException(prefix);
        }
        if (!Files.isDirectory(dir)) {
            throw new NotDirectoryException(prefix);
        }
        List<String> names = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            children.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(pattern::matches)
                    .forEach(names::add);
        }
        Collections.sort(names);
        
        List<String> locations = new ArrayList<>(names.size());
        for (String name : names) {
            locations.add(join(prefix, name));
        }
        return locations;
    }
    
    @Override
    public boolean exists(String location) {
        return Files.exists(toPath(location));
    }
    
    static Path toPath(String location) {
        if (location.startsWith(PREFIX)) {
            return Paths.get(location.substring(PREFIX.length()));
        }
        return Paths.get(location);
    }
}
