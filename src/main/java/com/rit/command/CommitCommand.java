package com.rit.command;

import com.rit.Rit;
import com.rit.errors.RitException;
import com.rit.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Path;

/**
 * rit commit - 将暂存区中的记录提交为新 commit，并推进 HEAD。
 * 提交信息可用 -m 或位置参数给出；暂存区为空时也会生成一个不含文件的 commit。
 */
@Command(name = "commit", mixinStandardHelpOptions = true, description = "提交暂存区到仓库")
public class CommitCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CommitCommand.class);

    @ParentCommand
    private Rit rit;

    @Option(names = {"-m", "--message"}, description = "提交信息")
    private String option;

    @Parameters(index = "0", arity = "0..1", paramLabel = "MESSAGE", description = "提交信息（与 -m 二选一）")
    private String positional;

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        if ((option == null) == (positional == null)) {
            System.err.println("fatal: give the commit message either with -m or as an argument");
            exitCode = 1;
            return;
        }
        String message = option != null ? option : positional;

        Path start = rit.getStartPath();
        Repository repo = Repository.find(start);
        if (repo == null) {
            System.err.println("fatal: not a rit repository (or any of the parent directories): " + Repository.RIT_DIR);
            exitCode = 1;
            return;
        }

        try {
            String hash = repo.getCommits().commit(message);
            String firstLine = message.contains("\n") ? message.substring(0, message.indexOf('\n')) : message;
            System.out.println("[" + hash.substring(0, 7) + "] " + firstLine);
        } catch (RitException e) {
            log.debug("commit failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        } catch (IOException e) {
            log.error("commit failed", e);
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
