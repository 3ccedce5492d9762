package com.rit.diff;

import com.rit.obj.Commit;
import lombok.Value;

import java.util.List;

/**
 * show 的结果：commit 本身及其每个文件条目的 diff，顺序与 commit 文件列表一致。
 */
@Value
public class CommitDiff {
    String hash;
    Commit commit;
    List<FileDiff> files;
}
