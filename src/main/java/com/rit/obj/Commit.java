package com.rit.obj;

import com.rit.errors.CorruptObjectException;
import com.rit.utils.HexUtils;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * rit commit 对象：时间戳、提交信息、文件列表、可选的父提交。
 * 序列化格式（version 1）：
 * <pre>
 * rit-commit 1
 * timestamp 2024-01-01T00:00:00Z
 * parent &lt;hash&gt;          （根提交无此行）
 * file &lt;hash&gt; &lt;path&gt;     （每个文件一行，保持原顺序）
 *
 * message
 * </pre>
 * 字段顺序固定，相同内容总是得到相同字节，因此 hash 也相同。
 */
public final class Commit implements RitObject {

    public static final String MAGIC = "rit-commit";
    public static final int VERSION = 1;

    private static final String TIMESTAMP = "timestamp ";
    private static final String PARENT = "parent ";
    private static final String FILE = "file ";

    private final String timestamp;
    private final String message;
    private final List<IndexEntry> files;
    private final String parent; // 可选，根提交为 null

    /**
     * 用时间戳、提交信息、文件列表、父提交构造 commit；message 为 null 时当作空字符串，parent 可为 null。
     * 路径中不允许出现换行。
     */
    public Commit(String timestamp, String message, List<IndexEntry> files, String parent) {
        if (timestamp == null || timestamp.isEmpty() || timestamp.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("invalid timestamp: " + timestamp);
        }
        if (parent != null && !HexUtils.isHash(parent)) {
            throw new IllegalArgumentException("invalid parent hash: " + parent);
        }
        List<IndexEntry> copy = new ArrayList<>(files != null ? files : List.of());
        for (IndexEntry e : copy) {
            if (e.getPath().isEmpty() || e.getPath().indexOf('\n') >= 0) {
                throw new IllegalArgumentException("invalid path: " + e.getPath());
            }
            if (!HexUtils.isHash(e.getHash())) {
                throw new IllegalArgumentException("invalid blob hash for " + e.getPath() + ": " + e.getHash());
            }
        }
        this.timestamp = timestamp;
        this.message = message != null ? message : "";
        this.files = Collections.unmodifiableList(copy);
        this.parent = parent;
    }

    /** 以当前时间（UTC，ISO-8601）构造 commit。 */
    public static Commit create(String message, List<IndexEntry> files, String parent) {
        return new Commit(Instant.now().toString(), message, files, parent);
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    /** 文件列表（只读，保持提交时的顺序，可能含重复路径）。 */
    public List<IndexEntry> getFiles() {
        return files;
    }

    /** 父提交 hash，根提交返回 null。 */
    public String getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** 不含文件列表的元数据视图。 */
    public CommitSummary toSummary(String hash) {
        return new CommitSummary(hash, timestamp, message, parent);
    }

    @Override
    public byte[] toBytes() {
        StringBuilder sb = new StringBuilder();
        sb.append(MAGIC).append(' ').append(VERSION).append('\n');
        sb.append(TIMESTAMP).append(timestamp).append('\n');
        if (parent != null) sb.append(PARENT).append(parent).append('\n');
        for (IndexEntry e : files) {
            sb.append(FILE).append(e.getHash()).append(' ').append(e.getPath()).append('\n');
        }
        sb.append('\n');
        sb.append(message);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 从对象库中读出的字节解析 commit。
     * 头部必须按 magic、timestamp、parent（可选）、file* 的顺序出现，否则视为损坏。
     *
     * @param hash 对象 hash，仅用于错误信息
     */
    public static Commit parse(String hash, byte[] raw) throws CorruptObjectException {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CorruptObjectException("object " + hash + " is not valid UTF-8 text", e);
        }
        int headerEnd = text.indexOf("\n\n");
        if (headerEnd < 0) {
            throw new CorruptObjectException("object " + hash + " is not a commit: missing header terminator");
        }
        String[] lines = text.substring(0, headerEnd).split("\n", -1);
        String message = text.substring(headerEnd + 2);

        if (!lines[0].equals(MAGIC + " " + VERSION)) {
            if (lines[0].startsWith(MAGIC + " ")) {
                throw new CorruptObjectException("commit " + hash + " has unsupported version: " + lines[0]);
            }
            throw new CorruptObjectException("object " + hash + " is not a commit");
        }
        int i = 1;
        if (i >= lines.length || !lines[i].startsWith(TIMESTAMP)) {
            throw new CorruptObjectException("commit " + hash + " has no timestamp");
        }
        String timestamp = lines[i++].substring(TIMESTAMP.length());
        try {
            Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            throw new CorruptObjectException("commit " + hash + " has invalid timestamp: " + timestamp, e);
        }

        String parent = null;
        if (i < lines.length && lines[i].startsWith(PARENT)) {
            parent = lines[i++].substring(PARENT.length());
            if (!HexUtils.isHash(parent)) {
                throw new CorruptObjectException("commit " + hash + " has invalid parent: " + parent);
            }
        }

        List<IndexEntry> files = new ArrayList<>();
        for (; i < lines.length; i++) {
            String line = lines[i];
            // "file " + 40 位 hash + " " + 非空 path
            if (!line.startsWith(FILE) || line.length() < FILE.length() + 42
                    || line.charAt(FILE.length() + 40) != ' ') {
                throw new CorruptObjectException("commit " + hash + " has malformed line: " + line);
            }
            String fileHash = line.substring(FILE.length(), FILE.length() + 40);
            if (!HexUtils.isHash(fileHash)) {
                throw new CorruptObjectException("commit " + hash + " has invalid file hash: " + fileHash);
            }
            files.add(new IndexEntry(line.substring(FILE.length() + 41), fileHash));
        }
        return new Commit(timestamp, message, files, parent);
    }
}
