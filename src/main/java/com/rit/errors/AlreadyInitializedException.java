package com.rit.errors;

import java.nio.file.Path;

/**
 * init 时仓库结构已存在。由 init 命令捕获并作为提示输出，不视为失败。
 */
public class AlreadyInitializedException extends RitException {

    private final transient Path ritDir;

    public AlreadyInitializedException(Path ritDir) {
        super("repository already initialized: " + ritDir);
        this.ritDir = ritDir;
    }

    /** 已存在的 .rit 目录路径；内存存储时为 null。 */
    public Path getRitDir() {
        return ritDir;
    }
}
