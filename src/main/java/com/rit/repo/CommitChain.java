package com.rit.repo;

import com.rit.errors.CorruptObjectException;
import com.rit.errors.NotFoundException;
import com.rit.obj.Commit;
import com.rit.obj.CommitSummary;
import com.rit.obj.IndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * 提交链：由暂存区生成 commit、推进 HEAD，并沿 parent 向前遍历历史。
 */
public final class CommitChain {

    private static final Logger log = LoggerFactory.getLogger(CommitChain.class);

    private final ObjectStore objects;
    private final Head head;
    private final StagingIndex index;

    public CommitChain(ObjectStore objects, Head head, StagingIndex index) {
        this.objects = objects;
        this.head = head;
        this.index = index;
    }

    /** 当前 HEAD 指向的 commit hash，尚无提交时为 null。 */
    public String head() throws IOException {
        return head.read();
    }

    /**
     * 将暂存区内容提交为新 commit，parent 为当前 HEAD。暂存区为空时生成 files 为空的 commit。
     * 顺序：写 commit 对象、更新 HEAD、写回清空后的 index（base 指向新 HEAD）。
     * 若在更新 HEAD 后中断，残留的 index 因 base 与 HEAD 不一致会在下次加载时被丢弃。
     *
     * @return 新 commit 的 hash
     * @throws NotFoundException 暂存条目引用的 blob 不在对象库中
     */
    public String commit(String message) throws IOException {
        String parent = head.read();
        index.load(parent);
        List<IndexEntry> files = index.snapshot();
        for (IndexEntry e : files) {
            if (!objects.exists(e.getHash())) {
                throw new NotFoundException("staged blob " + e.getHash() + " for " + e.getPath() + " is missing");
            }
        }

        Commit commit = Commit.create(message, files, parent);
        String hash = objects.store(commit);
        log.debug("stored commit {} parent={} files={}", hash, parent, files.size());

        head.write(hash);
        index.clear();
        index.setBase(hash);
        index.save();
        log.info("commit created {} parent={}", hash, parent);
        return hash;
    }

    /**
     * 加载并解析 commit。
     *
     * @throws NotFoundException      对象不存在
     * @throws CorruptObjectException 对象不是合法的 commit 记录
     */
    public Commit getCommit(String hash) throws IOException {
        byte[] raw = objects.get(hash);
        return Commit.parse(hash, raw);
    }

    /**
     * 从 HEAD 开始沿 parent 依次返回 commit 元数据（最新在前），按需逐个加载。
     * 每次调用 iterator() 都重新读取 HEAD。读取失败以 UncheckedIOException 抛出，cause 为原始异常；
     * 遇到重复出现的 hash（环）时抛出 CorruptObjectException。
     */
    public Iterable<CommitSummary> log() {
        return LogIterator::new;
    }

    private final class LogIterator implements Iterator<CommitSummary> {

        private final Set<String> visited = new HashSet<>();
        private boolean started;
        private String next;

        @Override
        public boolean hasNext() {
            if (!started) {
                started = true;
                try {
                    next = head.read();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return next != null;
        }

        @Override
        public CommitSummary next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String hash = next;
            try {
                if (!visited.add(hash)) {
                    throw new CorruptObjectException("commit chain contains a cycle at " + hash);
                }
                Commit commit = getCommit(hash);
                next = commit.getParent();
                log.debug("log visited {} parent={}", hash, next);
                return commit.toSummary(hash);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
