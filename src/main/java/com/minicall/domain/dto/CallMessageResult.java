package com.minicall.domain.dto;

/**
 * @param appended false 表示同一 (callId, status) 已经写过
 */
public record CallMessageResult(
        long callId,
        String status,
        boolean appended
) {
}
