package com.rit.obj;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * rit blob 对象：文件内容快照，序列化格式即原始字节。
 */
public final class Blob implements RitObject {

    private final byte[] data;

    /** 用给定字节构造 blob，null 视为空数组并做拷贝避免外部修改。 */
    public Blob(byte[] data) {
        this.data = data != null ? data.clone() : new byte[0];
    }

    /** 以 UTF-8 编码的文本构造 blob。 */
    public static Blob ofText(String text) {
        return new Blob(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] toBytes() {
        return Arrays.copyOf(data, data.length);
    }

    /** 按 UTF-8 解码的文本内容。 */
    public String getText() {
        return new String(data, StandardCharsets.UTF_8);
    }
}
