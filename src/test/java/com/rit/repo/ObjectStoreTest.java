package com.rit.repo;

import com.rit.errors.NotFoundException;
import com.rit.obj.Blob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ObjectStore 测试")
class ObjectStoreTest {

    /**
     * hash 为内容 UTF-8 字节的 SHA-1，40 位小写 hex，与 `echo hello | sha1sum` 一致。
     */
    @Test
    @DisplayName("hash 为内容的 SHA-1 且多次计算结果一致")
    void hash_isStableSha1() {
        byte[] hello = "hello\n".getBytes(StandardCharsets.UTF_8);
        assertThat(ObjectStore.hash(hello)).isEqualTo("f572d396fae9206628714fb2ce00f72e94f2258f");
        assertThat(ObjectStore.hash(hello)).isEqualTo(ObjectStore.hash("hello\n".getBytes(StandardCharsets.UTF_8)));
        assertThat(ObjectStore.hash(new byte[0])).isEqualTo("da39a3ee5e6b4b0d3255bfef95601890afd80709");
        assertThat(ObjectStore.hash("hello".getBytes(StandardCharsets.UTF_8))).isNotEqualTo(ObjectStore.hash(hello));
    }

    @Test
    @DisplayName("put 后 get 得到相同内容（文件存储）")
    void putAndGet_fileStorage(@TempDir Path dir) throws Exception {
        ObjectStore store = new ObjectStore(new FileStorage(dir.resolve(".rit")));
        for (String content : List.of("", "hello\n", "多字节 内容\n", "no newline")) {
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            String hash = store.put(bytes);
            assertThat(hash).matches("[0-9a-f]{40}");
            assertThat(store.get(hash)).isEqualTo(bytes);
            assertThat(dir.resolve(".rit").resolve("objects").resolve(hash)).exists();
        }
    }

    @Test
    @DisplayName("put 后 get 得到相同内容（内存存储）")
    void putAndGet_inMemory() throws Exception {
        ObjectStore store = new ObjectStore(new InMemoryStorage());
        String hash = store.store(Blob.ofText("hello\n"));
        assertThat(store.exists(hash)).isTrue();
        assertThat(store.getBlob(hash).getText()).isEqualTo("hello\n");
    }

    @Test
    @DisplayName("重复 put 相同内容返回相同 hash 且不改写已有对象")
    void put_isIdempotent(@TempDir Path dir) throws Exception {
        Path ritDir = dir.resolve(".rit");
        ObjectStore store = new ObjectStore(new FileStorage(ritDir));
        byte[] bytes = "same".getBytes(StandardCharsets.UTF_8);
        String first = store.put(bytes);
        Path object = ritDir.resolve("objects").resolve(first);
        // 篡改后再次 put，不重新写入，也不校验已有内容
        Files.write(object, "tampered".getBytes(StandardCharsets.UTF_8));
        String second = store.put(bytes);
        assertThat(second).isEqualTo(first);
        assertThat(Files.readString(object)).isEqualTo("tampered");
        try (Stream<Path> files = Files.list(ritDir.resolve("objects"))) {
            assertThat(files.count()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("get 不存在的 hash 抛出 NotFoundException")
    void get_missing_throwsNotFound(@TempDir Path dir) {
        ObjectStore fileStore = new ObjectStore(new FileStorage(dir.resolve(".rit")));
        ObjectStore memStore = new ObjectStore(new InMemoryStorage());
        String missing = "0".repeat(40);
        assertThatThrownBy(() -> fileStore.get(missing)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> memStore.get(missing)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fileStore.get("../HEAD")).isInstanceOf(NotFoundException.class);
    }
}
