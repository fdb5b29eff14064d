package com.minicall.client.api;

/**
 * 网络错误或服务端 5xx，可重试。
 */
public class CallTransportException extends CallClientException {

    private final int httpStatus;

    public CallTransportException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public CallTransportException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = 0;
    }

    /** 0 表示请求没有拿到响应 */
    public int getHttpStatus() {
        return httpStatus;
    }
}
