package com.rit.obj;

import lombok.Value;

/**
 * log 视图中的一条提交元数据，不含文件列表。parent 为 null 表示根提交。
 */
@Value
public class CommitSummary {
    String hash;
    String timestamp;
    String message;
    String parent;
}
