package com.rit.command;

import com.rit.Rit;
import com.rit.errors.RitException;
import com.rit.obj.CommitSummary;
import com.rit.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * rit log - 从 HEAD 开始沿 parent 输出提交历史，最新在前，不列出文件。
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "显示提交历史")
public class LogCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(LogCommand.class);

    @ParentCommand
    private Rit rit;

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        Path start = rit.getStartPath();
        Repository repo = Repository.find(start);
        if (repo == null) {
            System.err.println("fatal: not a rit repository (or any of the parent directories): " + Repository.RIT_DIR);
            exitCode = 1;
            return;
        }

        int count = 0;
        try {
            for (CommitSummary c : repo.getCommits().log()) {
                if (count > 0) System.out.println();
                printCommit(System.out, c);
                count++;
            }
            if (count == 0) {
                System.out.println("no commits yet");
            }
        } catch (UncheckedIOException e) {
            IOException cause = e.getCause();
            if (cause instanceof RitException) {
                log.debug("log failed", cause);
            } else {
                log.error("log failed", cause);
            }
            System.err.println("fatal: " + cause.getMessage());
            exitCode = 1;
        }
    }

    /**
     * 输出一条提交元数据：hash、时间、父提交、缩进的提交信息。
     */
    static void printCommit(PrintStream out, CommitSummary c) {
        out.println("commit " + c.getHash());
        out.println("Date:   " + c.getTimestamp());
        out.println("Parent: " + (c.getParent() != null ? c.getParent() : "(none)"));
        out.println();
        for (String line : c.getMessage().split("\n", -1)) {
            out.println("    " + line);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
