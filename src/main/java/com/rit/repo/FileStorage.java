package com.rit.repo;

import com.rit.errors.NotFoundException;
import com.rit.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 基于文件系统的存储：.rit/objects/&lt;hash&gt; 存对象，.rit/HEAD、.rit/index 存记录。
 * 所有写入先写临时文件再 rename 到目标位置。
 */
public final class FileStorage implements Storage {

    private static final Logger log = LoggerFactory.getLogger(FileStorage.class);

    static final String OBJECTS_DIR = "objects";

    private final Path ritDir;
    private final Path objectsDir;

    /**
     * 以 .rit 目录为基准，对象存储路径为 .rit/objects。
     */
    public FileStorage(Path ritDir) {
        this.ritDir = ritDir.toAbsolutePath().normalize();
        this.objectsDir = this.ritDir.resolve(OBJECTS_DIR);
    }

    @Override
    public Path getLocation() {
        return ritDir;
    }

    @Override
    public boolean isInitialized() {
        return Files.isDirectory(objectsDir) && Files.isRegularFile(ritDir.resolve(Head.HEAD_FILE));
    }

    @Override
    public void initialize() throws IOException {
        Files.createDirectories(objectsDir);
        Path headFile = ritDir.resolve(Head.HEAD_FILE);
        if (!Files.exists(headFile)) {
            Files.write(headFile, new byte[0]);
            log.debug("created empty HEAD {}", headFile);
        }
    }

    @Override
    public boolean hasObject(String hash) {
        return HexUtils.isHash(hash) && Files.isRegularFile(objectsDir.resolve(hash));
    }

    @Override
    public byte[] readObject(String hash) throws IOException {
        // 非法 hash 也按不存在处理，避免拼出 objects 目录之外的路径
        if (!hasObject(hash)) {
            throw new NotFoundException("object not found: " + hash);
        }
        return Files.readAllBytes(objectsDir.resolve(hash));
    }

    @Override
    public void writeObject(String hash, byte[] content) throws IOException {
        if (!HexUtils.isHash(hash)) {
            throw new IllegalArgumentException("invalid hash: " + hash);
        }
        Files.createDirectories(objectsDir);
        replaceAtomically(objectsDir.resolve(hash), content);
        log.debug("wrote object {} ({} bytes)", hash, content.length);
    }

    @Override
    public byte[] readRecord(String name) throws IOException {
        Path p = ritDir.resolve(name);
        if (!Files.exists(p)) {
            return null;
        }
        return Files.readAllBytes(p);
    }

    @Override
    public void writeRecord(String name, byte[] content) throws IOException {
        Files.createDirectories(ritDir);
        replaceAtomically(ritDir.resolve(name), content);
        log.debug("wrote record {} ({} bytes)", name, content.length);
    }

    /**
     * 先写同目录下的临时文件，再移动覆盖目标；文件系统不支持原子移动时退化为普通覆盖移动。
     */
    private static void replaceAtomically(Path target, byte[] content) throws IOException {
        Path temp = target.resolveSibling("tmp_" + target.getFileName() + "_" + System.nanoTime());
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("atomic move not supported for {}, falling back", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
