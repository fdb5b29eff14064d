package com.minicall.domain.exception;

/**
 * 操作者不是会话成员，或者角色不允许（例如主叫试图 accept 自己的来电）。
 */
public class CallForbiddenException extends RuntimeException {

    public CallForbiddenException(String message) {
        super(message);
    }
}
