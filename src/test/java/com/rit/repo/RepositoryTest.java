package com.rit.repo;

import com.rit.errors.AlreadyInitializedException;
import com.rit.errors.NotFoundException;
import com.rit.obj.IndexEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Repository 测试")
class RepositoryTest {

    @Test
    @DisplayName("initialize 创建 objects、HEAD、index，再次调用抛出 AlreadyInitializedException")
    void initialize_createsLayout(@TempDir Path dir) throws Exception {
        Repository repo = new Repository(dir);
        repo.initialize();

        Path ritDir = dir.resolve(".rit");
        assertThat(ritDir.resolve("objects")).isDirectory();
        assertThat(Files.readAllBytes(ritDir.resolve("HEAD"))).isEmpty();
        assertThat(ritDir.resolve("index")).exists();

        assertThatThrownBy(repo::initialize)
                .isInstanceOf(AlreadyInitializedException.class)
                .satisfies(e -> assertThat(((AlreadyInitializedException) e).getRitDir()).isEqualTo(ritDir));
    }

    @Test
    @DisplayName("重复 initialize 会补齐缺失的 index 且保留 HEAD")
    void initialize_repairsMissingIndex(@TempDir Path dir) throws Exception {
        Repository repo = new Repository(dir);
        repo.initialize();
        Files.delete(dir.resolve(".rit").resolve("index"));

        assertThatThrownBy(repo::initialize).isInstanceOf(AlreadyInitializedException.class);
        assertThat(dir.resolve(".rit").resolve("index")).exists();
    }

    @Test
    @DisplayName("find 从子目录向上找到仓库根，找不到时返回 null")
    void find_walksUp(@TempDir Path dir) throws Exception {
        assertThat(Repository.find(dir)).isNull();
        new Repository(dir).initialize();
        Path nested = Files.createDirectories(dir.resolve("a").resolve("b"));

        Repository found = Repository.find(nested);
        assertThat(found).isNotNull();
        assertThat(found.getRoot()).isEqualTo(dir.toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("add 文件写入 blob 并追加 index 记录，路径相对仓库根")
    void add_files(@TempDir Path dir) throws Exception {
        Repository repo = new Repository(dir);
        repo.initialize();
        Files.createDirectories(dir.resolve("src"));
        Files.write(dir.resolve("a.txt"), "hello\n".getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("src").resolve("b.txt"), "b\n".getBytes(StandardCharsets.UTF_8));

        List<IndexEntry> added = repo.add(List.of(dir.resolve("a.txt"), dir.resolve("src/b.txt")));

        assertThat(added).extracting(IndexEntry::getPath).containsExactly("a.txt", "src/b.txt");
        assertThat(added.get(0).getHash()).isEqualTo("f572d396fae9206628714fb2ce00f72e94f2258f");
        assertThat(repo.getObjects().exists(added.get(0).getHash())).isTrue();
        assertThat(repo.staged()).isEqualTo(added);
    }

    @Test
    @DisplayName("add 目录按排序展开其下文件，跳过 .rit")
    void add_directory(@TempDir Path dir) throws Exception {
        Repository repo = new Repository(dir);
        repo.initialize();
        Path sub = Files.createDirectories(dir.resolve("docs").resolve("inner"));
        Files.write(dir.resolve("docs").resolve("z.txt"), "z".getBytes(StandardCharsets.UTF_8));
        Files.write(sub.resolve("a.txt"), "a".getBytes(StandardCharsets.UTF_8));
        Files.write(dir.resolve("root.txt"), "r".getBytes(StandardCharsets.UTF_8));

        List<IndexEntry> added = repo.add(List.of(dir));

        assertThat(added).extracting(IndexEntry::getPath)
                .containsExactly("docs/inner/a.txt", "docs/z.txt", "root.txt");
    }

    @Test
    @DisplayName("add 不存在的文件抛出 NotFoundException 且暂存区不变")
    void add_missingFile_throwsNotFound(@TempDir Path dir) throws Exception {
        Repository repo = new Repository(dir);
        repo.initialize();
        Files.write(dir.resolve("a.txt"), "a".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> repo.add(List.of(dir.resolve("a.txt"), dir.resolve("missing.txt"))))
                .isInstanceOf(NotFoundException.class);
        assertThat(repo.staged()).isEmpty();
    }

    @Test
    @DisplayName("add 仓库外的文件被拒绝")
    void add_outsideRepository_rejected(@TempDir Path dir) throws Exception {
        Path root = Files.createDirectories(dir.resolve("repo"));
        Files.write(dir.resolve("outside.txt"), "o".getBytes(StandardCharsets.UTF_8));
        Repository repo = new Repository(root);
        repo.initialize();

        assertThatThrownBy(() -> repo.add(List.of(dir.resolve("outside.txt"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outside");
    }
}
