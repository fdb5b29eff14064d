package com.minicall.client.media.relay;

public enum RelayErrorCode {

    /** 当前连接状态下不允许该操作（例如频道状态还没就绪时 publish） */
    INVALID_OPERATION,

    INVALID_TOKEN,

    TOKEN_EXPIRED,

    NETWORK_ERROR,

    OPERATION_ABORTED,

    UNEXPECTED_ERROR
}
