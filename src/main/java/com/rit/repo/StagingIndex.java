package com.rit.repo;

import com.rit.errors.CorruptObjectException;
import com.rit.obj.IndexEntry;
import com.rit.utils.HexUtils;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 暂存区（index）：按 add 的顺序记录 (path, hash)，供下一次 commit 使用。
 * 同一 path 多次 add 会产生多条记录，不合并、不去重。
 * <p>
 * 文件格式（version 1，大端）：
 * "RIDX" + version(4) + base 标志(1) + base hash(20) + entry 数(4)，
 * 每条 entry 为 hash(20) + path 长度(2) + path(UTF-8)，末尾 20 字节为前面全部内容的 SHA-1 校验和。
 * <p>
 * base 为写入 index 时的 HEAD。加载时若 base 与当前 HEAD 不一致，说明上一次 commit 在
 * 更新 HEAD 之后、清空 index 之前中断，这些条目已被提交过，直接丢弃。
 */
public final class StagingIndex {

    private static final Logger log = LoggerFactory.getLogger(StagingIndex.class);

    static final String INDEX_FILE = "index";
    private static final byte[] SIGNATURE = new byte[]{'R', 'I', 'D', 'X'};
    private static final int VERSION = 1;
    private static final int HASH_SIZE = 20;
    private static final int CHECKSUM_SIZE = 20;
    private static final int HEADER_SIZE = 4 + 4 + 1 + HASH_SIZE + 4;
    private static final int MAX_PATH_BYTES = 0xFFFF;

    private final Storage storage;
    private final List<IndexEntry> entries = new ArrayList<>();
    private String base;

    public StagingIndex(Storage storage) {
        this.storage = storage;
    }

    /**
     * 从存储加载暂存区；记录不存在视为空暂存区。
     *
     * @param currentHead 当前 HEAD，可为 null
     * @throws CorruptObjectException index 格式或校验和不正确
     */
    public void load(String currentHead) throws IOException {
        entries.clear();
        base = currentHead;
        byte[] raw = storage.readRecord(INDEX_FILE);
        if (raw == null) {
            log.debug("index record not found, using empty index");
            return;
        }
        Decoded decoded = decode(raw);
        if (!Objects.equals(decoded.getBase(), currentHead)) {
            log.warn("discarding {} staged entries left by an interrupted commit (index base={}, HEAD={})",
                    decoded.getEntries().size(), decoded.getBase(), currentHead);
            return;
        }
        entries.addAll(decoded.getEntries());
        log.debug("loaded index entries={} base={}", entries.size(), base);
    }

    /**
     * 将当前暂存区整体写回存储。
     */
    public void save() throws IOException {
        storage.writeRecord(INDEX_FILE, encode(base, entries));
        log.debug("saved index entries={} base={}", entries.size(), base);
    }

    /** 追加一条记录，不检查同名 path 是否已存在。 */
    public void add(String path, String hash) {
        if (path == null || path.isEmpty() || path.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("invalid path: " + path);
        }
        if (path.getBytes(StandardCharsets.UTF_8).length > MAX_PATH_BYTES) {
            throw new IllegalArgumentException("path too long: " + path);
        }
        if (!HexUtils.isHash(hash)) {
            throw new IllegalArgumentException("invalid hash: " + hash);
        }
        entries.add(new IndexEntry(path, hash));
        log.debug("add entry path={} hash={}", path, hash);
    }

    /** 返回当前所有暂存条目的拷贝，不修改状态。 */
    public List<IndexEntry> snapshot() {
        return new ArrayList<>(entries);
    }

    /** 清空暂存区，仅在 commit 成功时调用。 */
    public void clear() {
        entries.clear();
    }

    /** 写入 index 时对应的 HEAD，可为 null。 */
    public String getBase() {
        return base;
    }

    /** commit 推进 HEAD 后，令 index 与新 HEAD 对齐。 */
    void setBase(String head) {
        this.base = head;
    }

    static byte[] encode(String base, List<IndexEntry> entries) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(SIGNATURE);
        writeInt(out, VERSION);
        if (base != null) {
            out.write(1);
            out.writeBytes(HexUtils.hexToBytes(base));
        } else {
            out.write(0);
            out.writeBytes(new byte[HASH_SIZE]);
        }
        writeInt(out, entries.size());
        for (IndexEntry e : entries) {
            out.writeBytes(HexUtils.hexToBytes(e.getHash()));
            byte[] nameBytes = e.getPath().getBytes(StandardCharsets.UTF_8);
            writeShort(out, nameBytes.length);
            out.writeBytes(nameBytes);
        }
        byte[] content = out.toByteArray();
        out.writeBytes(HexUtils.sha1(content));
        return out.toByteArray();
    }

    static Decoded decode(byte[] raw) throws CorruptObjectException {
        if (raw.length < HEADER_SIZE + CHECKSUM_SIZE) {
            throw new CorruptObjectException("index file too short: " + raw.length + " bytes");
        }
        // 校验和：最后 20 字节为前面内容的 SHA-1
        int contentEnd = raw.length - CHECKSUM_SIZE;
        byte[] content = new byte[contentEnd];
        System.arraycopy(raw, 0, content, 0, contentEnd);
        byte[] expectedChecksum = new byte[CHECKSUM_SIZE];
        System.arraycopy(raw, contentEnd, expectedChecksum, 0, CHECKSUM_SIZE);
        if (!MessageDigest.isEqual(expectedChecksum, HexUtils.sha1(content))) {
            throw new CorruptObjectException("index checksum mismatch");
        }

        ByteBuffer buf = ByteBuffer.wrap(content).order(ByteOrder.BIG_ENDIAN);
        for (int i = 0; i < SIGNATURE.length; i++) {
            if (buf.get() != SIGNATURE[i]) {
                throw new CorruptObjectException("index signature invalid");
            }
        }
        int version = buf.getInt();
        if (version != VERSION) {
            throw new CorruptObjectException("index version " + version + " not supported");
        }
        int baseFlag = buf.get();
        byte[] baseBytes = new byte[HASH_SIZE];
        buf.get(baseBytes);
        String base;
        if (baseFlag == 1) {
            base = HexUtils.bytesToHex(baseBytes);
        } else if (baseFlag == 0) {
            base = null;
        } else {
            throw new CorruptObjectException("index base flag invalid: " + baseFlag);
        }
        int numEntries = buf.getInt();
        if (numEntries < 0) {
            throw new CorruptObjectException("index entry count invalid: " + numEntries);
        }
        log.debug("index version={} numEntries={}", version, numEntries);

        List<IndexEntry> entries = new ArrayList<>();
        for (int i = 0; i < numEntries; i++) {
            if (buf.remaining() < HASH_SIZE + 2) {
                throw new CorruptObjectException("index truncated at entry " + i);
            }
            byte[] hashBytes = new byte[HASH_SIZE];
            buf.get(hashBytes);
            int nameLen = buf.getShort() & 0xFFFF;
            if (nameLen == 0 || buf.remaining() < nameLen) {
                throw new CorruptObjectException("index path truncated at entry " + i);
            }
            byte[] nameBytes = new byte[nameLen];
            buf.get(nameBytes);
            entries.add(new IndexEntry(new String(nameBytes, StandardCharsets.UTF_8), HexUtils.bytesToHex(hashBytes)));
        }
        if (buf.hasRemaining()) {
            throw new CorruptObjectException("index has " + buf.remaining() + " trailing bytes");
        }
        return new Decoded(base, entries);
    }

    private static void writeInt(ByteArrayOutputStream out, int v) {
        out.write((v >> 24) & 0xff);
        out.write((v >> 16) & 0xff);
        out.write((v >> 8) & 0xff);
        out.write(v & 0xff);
    }

    private static void writeShort(ByteArrayOutputStream out, int v) {
        out.write((v >> 8) & 0xff);
        out.write(v & 0xff);
    }

    /** 解码后的 index 内容。 */
    @Value
    static class Decoded {
        String base;
        List<IndexEntry> entries;
    }
}
