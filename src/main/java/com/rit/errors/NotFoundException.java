package com.rit.errors;

/**
 * 引用的对象、提交或工作区文件不存在。
 */
public class NotFoundException extends RitException {

    public NotFoundException(String message) {
        super(message);
    }
}
