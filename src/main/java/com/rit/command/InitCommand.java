package com.rit.command;

import com.rit.Rit;
import com.rit.errors.AlreadyInitializedException;
import com.rit.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Path;

/**
 * rit init - 在当前目录或指定路径创建 .rit、.rit/objects、.rit/HEAD、.rit/index。
 * 重复执行是安全的：已存在的仓库只输出提示，不视为错误。
 */
@Command(name = "init", mixinStandardHelpOptions = true, description = "创建空的 rit 仓库")
public class InitCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    @ParentCommand
    private Rit rit;

    @Parameters(index = "0", arity = "0..1", description = "仓库根路径，默认为当前目录")
    private Path path;

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        Path root = path != null ? rit.getStartPath().resolve(path).normalize() : rit.getStartPath();
        Repository repo = new Repository(root);
        log.debug("init root={}", root);

        try {
            repo.initialize();
            System.out.println("Initialized empty Rit repository in " + repo.getRitDir());
        } catch (AlreadyInitializedException e) {
            log.info("init: {}", e.getMessage());
            System.out.println("Reinitialized existing Rit repository in " + e.getRitDir());
        } catch (IOException e) {
            log.error("init failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        }
    }

    /** 返回本命令的退出码（0 成功，1 失败）。 */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
