package com.rit.diff;

import lombok.Value;

import java.util.List;

/**
 * commit 中一个文件相对父提交的变化。
 */
@Value
public class FileDiff {

    public enum Status {
        /** commit 没有父提交，不做 diff。 */
        INITIAL_COMMIT,
        /** 父提交中没有同路径文件，不做 diff。 */
        NEW_FILE,
        /** 与父提交中同路径文件做了 diff。 */
        MODIFIED
    }

    String path;
    String hash;
    Status status;
    /** 父提交中匹配文件的 hash，仅 MODIFIED 时非 null。 */
    String oldHash;
    String newText;
    /** 仅 MODIFIED 时非空。 */
    List<DiffSegment> segments;

    public boolean hasChanges() {
        return segments.stream().anyMatch(s -> s.getKind() != DiffSegment.Kind.EQUAL);
    }
}
