package com.rit.obj;

/**
 * rit 对象统一接口：blob、commit。
 * 对象以原始字节写入 .rit/objects/&lt;hash&gt;，hash = SHA1(toBytes())。
 */
public interface RitObject {

    /** 对象体字节，即写入对象库的原始内容。 */
    byte[] toBytes();
}
