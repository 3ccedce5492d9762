package com.rit.repo;

import com.rit.obj.Blob;
import com.rit.obj.RitObject;
import com.rit.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 内容寻址的对象库：hash = SHA1(content)，按 hash 写入/读取不可变对象（blob、commit）。
 * 不做压缩，对象以原始字节保存。
 */
public final class ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(ObjectStore.class);

    private final Storage storage;

    public ObjectStore(Storage storage) {
        this.storage = storage;
    }

    /**
     * 计算内容的 40 字符 hex hash，与存储无关的纯函数。
     */
    public static String hash(byte[] content) {
        return HexUtils.sha1Hex(content);
    }

    /**
     * 存储内容并返回 hash。已存在同 hash 对象时不重复写入。
     */
    public String put(byte[] content) throws IOException {
        String hash = hash(content);
        if (storage.hasObject(hash)) {
            log.debug("object {} already stored", hash);
            return hash;
        }
        storage.writeObject(hash, content);
        log.debug("stored object {} size={}", hash, content.length);
        return hash;
    }

    /** 序列化并存储 blob 或 commit，返回 hash。 */
    public String store(RitObject object) throws IOException {
        return put(object.toBytes());
    }

    /**
     * 读取对象原始字节。
     *
     * @throws com.rit.errors.NotFoundException 对象不存在
     */
    public byte[] get(String hash) throws IOException {
        return storage.readObject(hash);
    }

    public Blob getBlob(String hash) throws IOException {
        return new Blob(get(hash));
    }

    public boolean exists(String hash) {
        return storage.hasObject(hash);
    }
}
