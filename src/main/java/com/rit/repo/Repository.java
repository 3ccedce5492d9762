package com.rit.repo;

import com.rit.diff.DiffEngine;
import com.rit.errors.AlreadyInitializedException;
import com.rit.errors.NotFoundException;
import com.rit.obj.Blob;
import com.rit.obj.IndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 仓库：定位 .rit 目录，组装 ObjectStore、StagingIndex、CommitChain、DiffEngine、Workspace。
 * 代表整个 rit 仓库的一个抽象；存储后端可注入，便于在内存中使用。
 */
public final class Repository {

    private static final Logger log = LoggerFactory.getLogger(Repository.class);

    public static final String RIT_DIR = ".rit";

    private final Path root;
    private final Storage storage;
    private final ObjectStore objects;
    private final Head head;
    private final StagingIndex index;
    private final CommitChain commits;
    private final DiffEngine diffs;
    private final Workspace workspace;

    /**
     * 以给定路径为仓库根（工作区根），.rit 为 root/.rit，使用文件系统存储。
     */
    public Repository(Path root) {
        this(root, new FileStorage(root.toAbsolutePath().normalize().resolve(RIT_DIR)));
    }

    /**
     * 以给定路径为工作区根，使用指定的存储后端。
     */
    public Repository(Path root, Storage storage) {
        this.root = root.toAbsolutePath().normalize();
        this.storage = storage;
        this.objects = new ObjectStore(storage);
        this.head = new Head(storage);
        this.index = new StagingIndex(storage);
        this.commits = new CommitChain(objects, head, index);
        this.diffs = new DiffEngine(objects, commits);
        this.workspace = new Workspace(this.root);
    }

    /**
     * 从给定目录向上查找包含 .rit 的目录作为仓库根；未找到返回 null。
     */
    public static Repository find(Path start) {
        Path current = start.toAbsolutePath().normalize();
        log.debug("find repo start={}", current);
        while (current != null) {
            if (Files.isDirectory(current.resolve(RIT_DIR))) {
                log.debug("found repo at {}", current);
                return new Repository(current);
            }
            current = current.getParent();
        }
        log.debug("no repo found");
        return null;
    }

    /**
     * 创建仓库结构（objects、HEAD、index），已存在的部分保持不变。
     *
     * @throws AlreadyInitializedException 调用前仓库已完整存在；此时缺失的部分也已补齐
     */
    public void initialize() throws IOException {
        boolean existed = storage.isInitialized();
        storage.initialize();
        if (storage.readRecord(StagingIndex.INDEX_FILE) == null) {
            index.load(head.read());
            index.save();
        }
        if (existed) {
            throw new AlreadyInitializedException(storage.getLocation());
        }
        log.info("repository initialized at {}", storage.getLocation());
    }

    /**
     * 将工作区中的文件加入暂存区；目录会展开为其下所有普通文件（按路径排序）。
     * 先确认所有路径存在，再依次写入 blob、追加 index 记录，最后整体保存 index。
     *
     * @param paths 相对仓库根或绝对路径
     * @return 新追加的记录，顺序与写入 index 的顺序一致
     * @throws NotFoundException 某个路径不存在
     */
    public List<IndexEntry> add(List<Path> paths) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path p : paths) {
            Path resolved = root.resolve(p).normalize();
            if (Files.isDirectory(resolved)) {
                if (!resolved.startsWith(root)) {
                    throw new IllegalArgumentException("path outside repository: " + p);
                }
                files.addAll(workspace.listFiles(resolved));
            } else if (Files.isRegularFile(resolved)) {
                files.add(resolved);
            } else {
                throw new NotFoundException("pathspec '" + p + "' did not match any files");
            }
        }

        index.load(head.read());
        List<IndexEntry> added = new ArrayList<>();
        for (Path f : files) {
            added.add(stage(workspace.relativize(f), workspace.readFile(f)));
        }
        index.save();
        log.info("add completed, staged={} index entries={}", added.size(), index.snapshot().size());
        return added;
    }

    /**
     * 将给定内容以 path 加入暂存区，不读取工作区。
     */
    public IndexEntry add(String path, byte[] content) throws IOException {
        index.load(head.read());
        IndexEntry entry = stage(path, content);
        index.save();
        return entry;
    }

    /** 重新加载并返回当前暂存条目。 */
    public List<IndexEntry> staged() throws IOException {
        index.load(head.read());
        return index.snapshot();
    }

    private IndexEntry stage(String path, byte[] content) throws IOException {
        String hash = objects.store(new Blob(content));
        index.add(path, hash);
        log.debug("staged {} -> {} size={}", path, hash, content.length);
        return new IndexEntry(path, hash);
    }

    /**
     * 工作区根目录（即仓库根）。
     */
    public Path getRoot() {
        return root;
    }

    /**
     * .rit 目录路径；内存存储时为 null。
     */
    public Path getRitDir() {
        return storage.getLocation();
    }

    public ObjectStore getObjects() {
        return objects;
    }

    public StagingIndex getIndex() {
        return index;
    }

    public CommitChain getCommits() {
        return commits;
    }

    public DiffEngine getDiffs() {
        return diffs;
    }
}
