package com.rit.errors;

/**
 * 存储的字节无法解析为期望的记录格式（commit、index 等）。
 */
public class CorruptObjectException extends RitException {

    public CorruptObjectException(String message) {
        super(message);
    }

    public CorruptObjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
