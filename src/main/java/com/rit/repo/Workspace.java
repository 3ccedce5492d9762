package com.rit.repo;

import com.rit.errors.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 工作区：读取工作目录中的文件，并将其路径转换为相对仓库根的 / 分隔路径（排除 .rit）。
 */
public final class Workspace {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path root;

    /**
     * 以给定路径为工作区根目录。
     */
    public Workspace(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * 递归列出目录下的所有普通文件（跳过 .rit），按路径排序，保证 add 顺序确定。
     */
    public List<Path> listFiles(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (Stream<Path> stream = Files.list(dir)) {
            for (Path p : stream.sorted().collect(Collectors.toList())) {
                if (Repository.RIT_DIR.equals(p.getFileName().toString())) continue;
                if (Files.isDirectory(p)) {
                    files.addAll(listFiles(p));
                } else if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        }
        log.debug("listFiles dir={} count={}", dir, files.size());
        return files;
    }

    /**
     * 读取文件全部字节。
     *
     * @throws NotFoundException 文件不存在或不是普通文件
     */
    public byte[] readFile(Path filePath) throws IOException {
        Path p = root.resolve(filePath).normalize();
        if (!Files.isRegularFile(p)) {
            throw new NotFoundException("file not found: " + filePath);
        }
        return Files.readAllBytes(p);
    }

    /**
     * 将工作区内的绝对或相对路径转换为相对仓库根、以 / 分隔的路径。
     *
     * @throws IllegalArgumentException 路径不在工作区内，或位于 .rit 之下
     */
    public String relativize(Path filePath) {
        Path p = root.resolve(filePath).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new IllegalArgumentException("path outside repository: " + filePath);
        }
        Path relative = root.relativize(p);
        if (Repository.RIT_DIR.equals(relative.getName(0).toString())) {
            throw new IllegalArgumentException("path inside " + Repository.RIT_DIR + ": " + filePath);
        }
        return relative.toString().replace('\\', '/');
    }
}
