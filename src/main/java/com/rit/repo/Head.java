package com.rit.repo;

import com.rit.errors.CorruptObjectException;
import com.rit.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * HEAD 指针：记录最新 commit 的 hash，尚无提交时为空。
 */
public final class Head {

    private static final Logger log = LoggerFactory.getLogger(Head.class);

    static final String HEAD_FILE = "HEAD";

    private final Storage storage;

    public Head(Storage storage) {
        this.storage = storage;
    }

    /**
     * 读取 HEAD，返回当前 commit hash；文件不存在或为空时返回 null。
     *
     * @throws CorruptObjectException HEAD 内容不是合法的 hash
     */
    public String read() throws IOException {
        byte[] raw = storage.readRecord(HEAD_FILE);
        if (raw == null) {
            log.debug("read HEAD: no HEAD record");
            return null;
        }
        String content = new String(raw, StandardCharsets.UTF_8).trim();
        if (content.isEmpty()) {
            return null;
        }
        if (!HexUtils.isHash(content)) {
            throw new CorruptObjectException("HEAD does not contain a commit hash: " + content);
        }
        log.debug("read HEAD {}", content);
        return content;
    }

    /** 将 HEAD 整体替换为给定 commit hash。 */
    public void write(String hash) throws IOException {
        if (!HexUtils.isHash(hash)) {
            throw new IllegalArgumentException("invalid commit hash: " + hash);
        }
        storage.writeRecord(HEAD_FILE, hash.getBytes(StandardCharsets.UTF_8));
        log.debug("updated HEAD -> {}", hash);
    }
}
