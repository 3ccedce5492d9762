package com.rit.command;

import com.rit.Rit;
import com.rit.diff.CommitDiff;
import com.rit.diff.DiffSegment;
import com.rit.diff.FileDiff;
import com.rit.diff.LineDiff;
import com.rit.errors.RitException;
import com.rit.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;
import picocli.CommandLine.Help.Ansi;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * rit show - 输出 commit 信息以及每个文件相对父提交的行级 diff。
 * 新增行以 "++" 开头（绿色），删除行以 "--" 开头（红色），未变行原样输出；颜色随终端自动开启。
 * 根提交中的文件和父提交中没有的文件，整个内容以 "++" 行输出。
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "显示提交及其相对父提交的变更")
public class ShowCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ShowCommand.class);

    @ParentCommand
    private Rit rit;

    @Parameters(index = "0", paramLabel = "COMMIT", description = "commit hash")
    private String hash;

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

        try {
            CommitDiff diff = repo.getDiffs().showCommitDiff(hash);
            PrintStream out = System.out;
            LogCommand.printCommit(out, diff.getCommit().toSummary(diff.getHash()));
            for (FileDiff file : diff.getFiles()) {
                out.println();
                out.println("file: " + file.getPath() + " (" + file.getHash() + ")");
                switch (file.getStatus()) {
                    case INITIAL_COMMIT:
                        out.println("(initial commit)");
                        printContent(out, file.getNewText());
                        break;
                    case NEW_FILE:
                        out.println("(new file)");
                        printContent(out, file.getNewText());
                        break;
                    default:
                        printDiff(out, file);
                }
            }
        } catch (RitException e) {
            log.debug("show failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        } catch (IOException e) {
            log.error("show failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        }
    }

    // 没有父版本可比较的文件，全部内容按新增行输出
    private static void printContent(PrintStream out, String content) {
        for (String line : LineDiff.splitLines(content)) {
            out.println(colored(Ansi.Style.fg_green, "++" + stripNewline(line)));
        }
    }

    private static void printDiff(PrintStream out, FileDiff file) {
        if (!file.hasChanges()) {
            out.println("(no changes)");
            return;
        }
        for (DiffSegment s : file.getSegments()) {
            for (String line : LineDiff.splitLines(s.getText())) {
                String text = stripNewline(line);
                switch (s.getKind()) {
                    case ADDED:
                        out.println(colored(Ansi.Style.fg_green, "++" + text));
                        break;
                    case REMOVED:
                        out.println(colored(Ansi.Style.fg_red, "--" + text));
                        break;
                    default:
                        out.println(text);
                }
            }
        }
    }

    private static String stripNewline(String line) {
        return line.endsWith("\n") ? line.substring(0, line.length() - 1) : line;
    }

    private static String colored(Ansi.Style style, String text) {
        if (!Ansi.AUTO.enabled()) {
            return text;
        }
        return style.on() + text + style.off();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
