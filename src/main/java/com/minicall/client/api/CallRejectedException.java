package com.minicall.client.api;

/**
 * 服务端拒绝（4xx，非 401）：参数错误、无权限、不存在、状态冲突；以及服务端缺少签名配置。不重试。
 */
public class CallRejectedException extends CallClientException {

    private final int httpStatus;
    private final int code;

    public CallRejectedException(int httpStatus, int code, String message) {
        super(message);
        this.httpStatus = httpStatus;
        this.code = code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /** 业务错误码，见 ApiCodes */
    public int getCode() {
        return code;
    }
}
