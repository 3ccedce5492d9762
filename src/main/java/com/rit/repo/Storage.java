package com.rit.repo;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 仓库持久化后端：对象（按 hash 存取的不可变内容）与记录（HEAD、index 等整体覆盖写的小文件）。
 * 核心只通过此接口访问存储，文件系统与内存实现可互换。
 */
public interface Storage {

    /** 后端位置（如 .rit 目录）；内存实现返回 null。 */
    Path getLocation();

    /** 仓库结构（objects 与 HEAD）是否已存在。 */
    boolean isInitialized();

    /** 补齐缺失的仓库结构，已有内容保持不变。 */
    void initialize() throws IOException;

    boolean hasObject(String hash);

    /**
     * 读取对象原始字节。
     *
     * @throws com.rit.errors.NotFoundException 对象不存在
     */
    byte[] readObject(String hash) throws IOException;

    /** 写入对象；同一 hash 重复写入不会破坏已有内容。 */
    void writeObject(String hash, byte[] content) throws IOException;

    /** 读取记录全部字节，记录不存在时返回 null。 */
    byte[] readRecord(String name) throws IOException;

    /** 整体替换记录内容，写入是原子的：读者只会看到旧内容或新内容。 */
    void writeRecord(String name, byte[] content) throws IOException;
}
