package com.minicall.domain.call;

import com.minicall.domain.enums.CallStatus;

import java.time.LocalDateTime;

/**
 * 状态机的一次判定结果。
 *
 * @param changed   false 表示幂等 no-op，调用方不应写库也不应触发副作用
 * @param startedAt 需要写入的接通时间；不写时为 null
 * @param endedAt   需要写入的结束时间；不写时为 null
 */
public record CallTransition(
        CallStatus from,
        CallStatus to,
        boolean changed,
        LocalDateTime startedAt,
        LocalDateTime endedAt
) {

    static CallTransition unchanged(CallStatus current) {
        return new CallTransition(current, current, false, null, null);
    }
}
