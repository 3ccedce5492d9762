package com.rit.diff;

import com.rit.obj.Commit;
import com.rit.obj.IndexEntry;
import com.rit.repo.CommitChain;
import com.rit.repo.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 计算一个 commit 相对其父提交的逐文件 diff。
 * 父提交中同一路径有多条记录时，取列表中最后一条（即最后一次 add 的内容）。
 */
public final class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    private final ObjectStore objects;
    private final CommitChain commits;

    public DiffEngine(ObjectStore objects, CommitChain commits) {
        this.objects = objects;
        this.commits = commits;
    }

    /**
     * 对 commit 中的每个文件条目（保持原顺序，重复路径逐条处理）生成 FileDiff。
     *
     * @throws com.rit.errors.NotFoundException      commit、父提交或 blob 不存在
     * @throws com.rit.errors.CorruptObjectException commit 无法解析
     */
    public CommitDiff showCommitDiff(String hash) throws IOException {
        Commit commit = commits.getCommit(hash);
        Commit parent = commit.isRoot() ? null : commits.getCommit(commit.getParent());

        List<FileDiff> files = new ArrayList<>();
        for (IndexEntry entry : commit.getFiles()) {
            String newText = objects.getBlob(entry.getHash()).getText();
            if (parent == null) {
                files.add(new FileDiff(entry.getPath(), entry.getHash(), FileDiff.Status.INITIAL_COMMIT,
                        null, newText, List.of()));
                continue;
            }
            IndexEntry match = findLast(parent.getFiles(), entry.getPath());
            if (match == null) {
                files.add(new FileDiff(entry.getPath(), entry.getHash(), FileDiff.Status.NEW_FILE,
                        null, newText, List.of()));
                continue;
            }
            String oldText = objects.getBlob(match.getHash()).getText();
            List<DiffSegment> segments = LineDiff.diff(oldText, newText);
            log.debug("diff {} {} -> {} segments={}", entry.getPath(), match.getHash(), entry.getHash(), segments.size());
            files.add(new FileDiff(entry.getPath(), entry.getHash(), FileDiff.Status.MODIFIED,
                    match.getHash(), newText, segments));
        }
        return new CommitDiff(hash, commit, files);
    }

    private static IndexEntry findLast(List<IndexEntry> entries, String path) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).getPath().equals(path)) {
                return entries.get(i);
            }
        }
        return null;
    }
}
