package com.rit.command;

import com.rit.Rit;
import com.rit.RitTestUtil;
import com.rit.RitTestUtil.ExecuteResult;
import com.rit.obj.IndexEntry;
import com.rit.repo.Repository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * rit add 命令测试：单文件、多文件、重复添加、子目录执行、失败场景。
 */
@DisplayName("AddCommand 测试")
class AddCommandTest {

    private static final CommandLine RIT = Rit.createCommandLine();

    @Test
    @DisplayName("在非仓库目录执行 add 失败并提示 not a rit repository")
    void add_outsideRepo_fails(@TempDir Path dir) throws Exception {
        Files.write(dir.resolve("a.txt"), "a".getBytes(StandardCharsets.UTF_8));
        ExecuteResult result = RitTestUtil.executeWithCapturedOut(RIT, "-C", dir.toString(), "add", "a.txt");
        assertThat(result.getExitCode()).isNotEqualTo(0);
        assertThat(result.getErr()).contains("not a rit repository");
    }

    @Test
    @DisplayName("add 单个文件输出 blob hash，暂存区有且仅有一条记录")
    void add_singleFile_succeeds(@TempDir Path tempDir) throws Exception {
        RIT.execute("-C", tempDir.toString(), "init");
        Files.write(tempDir.resolve("a.txt"), "hello\n".getBytes(StandardCharsets.UTF_8));

        ExecuteResult result = RitTestUtil.executeWithCapturedOut(RIT, "-C", tempDir.toString(), "add", "a.txt");
        assertThat(result.getExitCode()).as("add err: %s", result.getErr()).isEqualTo(0);
        assertThat(result.getOutput()).contains("f572d396fae9206628714fb2ce00f72e94f2258f").contains("added a.txt");

        Repository repo = Repository.find(tempDir);
        assertThat(repo).isNotNull();
        List<IndexEntry> entries = repo.staged();
        assertThat(entries).containsExactly(new IndexEntry("a.txt", "f572d396fae9206628714fb2ce00f72e94f2258f"));
        assertThat(tempDir.resolve(".rit").resolve("objects").resolve("f572d396fae9206628714fb2ce00f72e94f2258f"))
                .hasBinaryContent("hello\n".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("同一文件 add 两次，暂存区保留两条记录")
    void add_sameFileTwice_appends(@TempDir Path tempDir) throws Exception {
        RIT.execute("-C", tempDir.toString(), "init");
        Path f = tempDir.resolve("a.txt");
        Files.write(f, "v1\n".getBytes(StandardCharsets.UTF_8));
        RitTestUtil.executeWithCapturedOut(RIT, "-C", tempDir.toString(), "add", "a.txt");
        Files.write(f, "v2\n".getBytes(StandardCharsets.UTF_8));
        RitTestUtil.executeWithCapturedOut(RIT, "-C", tempDir.toString(), "add", "a.txt");

        List<IndexEntry> entries = Repository.find(tempDir).staged();
        assertThat(entries).extracting(IndexEntry::getPath).containsExactly("a.txt", "a.txt");
        assertThat(entries.get(0).getHash()).isNotEqualTo(entries.get(1).getHash());
    }

    @Test
    @DisplayName("在子目录中执行 add，路径记录为相对仓库根")
    void add_fromSubdirectory(@TempDir Path tempDir) throws Exception {
        RIT.execute("-C", tempDir.toString(), "init");
        Path sub = Files.createDirectories(tempDir.resolve("src"));
        Files.write(sub.resolve("Main.java"), "class Main {}\n".getBytes(StandardCharsets.UTF_8));
        Files.write(sub.resolve("Util.java"), "class Util {}\n".getBytes(StandardCharsets.UTF_8));

        ExecuteResult result = RitTestUtil.executeWithCapturedOut(RIT, "-C", sub.toString(), "add", "Util.java", "Main.java");
        assertThat(result.getExitCode()).as("add err: %s", result.getErr()).isEqualTo(0);

        assertThat(Repository.find(tempDir).staged()).extracting(IndexEntry::getPath)
                .containsExactly("src/Util.java", "src/Main.java");
    }

    @Test
    @DisplayName("add 不存在的文件失败，暂存区不变")
    void add_missingFile_fails(@TempDir Path tempDir) throws Exception {
        RIT.execute("-C", tempDir.toString(), "init");
        ExecuteResult result = RitTestUtil.executeWithCapturedOut(RIT, "-C", tempDir.toString(), "add", "nope.txt");
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("fatal:").contains("nope.txt");
        assertThat(Repository.find(tempDir).staged()).isEmpty();
    }
}
