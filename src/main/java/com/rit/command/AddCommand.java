package com.rit.command;

import com.rit.Rit;
import com.rit.errors.RitException;
import com.rit.obj.IndexEntry;
import com.rit.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * rit add - 将工作区中的文件加入暂存区，支持一次添加多个路径；目录会展开为其下所有文件。
 * 每次 add 都追加记录，同一文件重复 add 会在暂存区留下多条记录。
 */
@Command(name = "add", mixinStandardHelpOptions = true, description = "将文件加入暂存区")
public class AddCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(AddCommand.class);

    @ParentCommand
    private Rit rit;

    @Parameters(index = "0", arity = "1..*", paramLabel = "PATH", description = "要添加的文件或目录路径（可多个）")
    private List<Path> paths;

    private int exitCode = 0;

    @Override
    public void run() {
        exitCode = 0;
        Path start = rit.getStartPath();
        log.debug("add start path={}", start);

        Repository repo = Repository.find(start);
        if (repo == null) {
            System.err.println("fatal: not a rit repository (or any of the parent directories): " + Repository.RIT_DIR);
            exitCode = 1;
            return;
        }

        List<Path> resolved = new ArrayList<>();
        for (Path p : paths) {
            resolved.add(start.resolve(p).normalize());
        }
        try {
            for (IndexEntry e : repo.add(resolved)) {
                System.out.println(e.getHash());
                System.out.println("added " + e.getPath());
            }
        } catch (RitException | IllegalArgumentException e) {
            log.debug("add failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        } catch (IOException e) {
            log.error("add failed", e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
