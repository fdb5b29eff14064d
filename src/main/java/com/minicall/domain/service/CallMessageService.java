package com.minicall.domain.service;

import com.minicall.domain.entity.CallSessionEntity;
import com.minicall.domain.enums.CallStatus;

/**
 * 通话记录消息（会话内的系统消息）。
 */
public interface CallMessageService {

    /**
     * 同一 (callId, status) 至多写一次。
     *
     * @return true 表示本次真正写入
     */
    boolean appendOnce(CallSessionEntity session, CallStatus status, int durationSeconds, long fromUserId);
}
