package com.minicall.domain.exception;

import com.minicall.domain.enums.CallStatus;
import lombok.Getter;

/**
 * 状态机拒绝的迁移（例如 ended -> accepted）。不重试，直接回给调用方。
 */
@Getter
public class CallStateConflictException extends RuntimeException {

    private final CallStatus current;

    public CallStateConflictException(String message, CallStatus current) {
        super(message);
        this.current = current;
    }
}
