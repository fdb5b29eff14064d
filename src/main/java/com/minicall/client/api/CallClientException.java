package com.minicall.client.api;

/**
 * 客户端 SDK 的异常基类。
 */
public class CallClientException extends RuntimeException {

    public CallClientException(String message) {
        super(message);
    }

    public CallClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
