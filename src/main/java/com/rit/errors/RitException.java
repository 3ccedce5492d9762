package com.rit.errors;

import java.io.IOException;

/**
 * rit 核心异常基类。继承 IOException，使核心各层保持 throws IOException 的签名；
 * 未被细分的 IOException 即视为底层存储读写失败。
 */
public class RitException extends IOException {

    public RitException(String message) {
        super(message);
    }

    public RitException(String message, Throwable cause) {
        super(message, cause);
    }
}
