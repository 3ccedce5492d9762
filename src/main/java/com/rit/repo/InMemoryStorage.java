package com.rit.repo;

import com.rit.errors.NotFoundException;
import com.rit.utils.HexUtils;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * 内存存储，不访问文件系统，用于嵌入式使用与测试。非线程安全。
 */
public final class InMemoryStorage implements Storage {

    private final Map<String, byte[]> objects = new HashMap<>();
    private final Map<String, byte[]> records = new HashMap<>();

    @Override
    public Path getLocation() {
        return null;
    }

    @Override
    public boolean isInitialized() {
        return records.containsKey(Head.HEAD_FILE);
    }

    @Override
    public void initialize() {
        records.putIfAbsent(Head.HEAD_FILE, new byte[0]);
    }

    @Override
    public boolean hasObject(String hash) {
        return objects.containsKey(hash);
    }

    @Override
    public byte[] readObject(String hash) throws NotFoundException {
        byte[] content = objects.get(hash);
        if (content == null) {
            throw new NotFoundException("object not found: " + hash);
        }
        return content.clone();
    }

    @Override
    public void writeObject(String hash, byte[] content) {
        if (!HexUtils.isHash(hash)) {
            throw new IllegalArgumentException("invalid hash: " + hash);
        }
        objects.put(hash, content.clone());
    }

    @Override
    public byte[] readRecord(String name) {
        byte[] content = records.get(name);
        return content != null ? content.clone() : null;
    }

    @Override
    public void writeRecord(String name, byte[] content) {
        records.put(name, content.clone());
    }
}
