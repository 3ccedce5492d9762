package com.rit.obj;

import lombok.Value;

/**
 * 暂存区与 commit 文件列表中的一条记录：相对路径 + blob hash。
 */
@Value
public class IndexEntry {
    /** 相对仓库根的路径，使用 / 分隔（如 "a/b.txt"）。 */
    String path;
    /** 40 字符 hex 的 blob hash。 */
    String hash;
}
