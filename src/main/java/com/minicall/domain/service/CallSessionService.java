package com.minicall.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.minicall.domain.dto.CallStatsDto;
import com.minicall.domain.entity.CallSessionEntity;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;

import java.util.List;

public interface CallSessionService extends IService<CallSessionEntity> {

    /**
     * 用户所在会话的通话记录，按 createdAt、id 倒序。
     */
    List<CallSessionEntity> historyForUser(long userId, Long conversationId, CallType callType, CallStatus status, int limit, int offset);

    long countHistoryForUser(long userId, Long conversationId, CallType callType, CallStatus status);

    CallStatsDto statsForUser(long userId);

    /**
     * 会话里尚未结束（ringing / accepted）的通话，没有时返回 null。
     */
    CallSessionEntity findLive(long conversationId);
}
