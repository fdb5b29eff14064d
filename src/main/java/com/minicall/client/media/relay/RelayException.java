package com.minicall.client.media.relay;

import lombok.Getter;

/**
 * 中继 SDK 返回的错误。
 */
@Getter
public class RelayException extends RuntimeException {

    private final RelayErrorCode code;

    public RelayException(RelayErrorCode code, String message) {
        super(code + ": " + message);
        this.code = code;
    }
}
