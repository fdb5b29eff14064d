package com.minicall.domain.service;

import com.minicall.domain.dto.CallHistoryResponse;
import com.minicall.domain.dto.CallMessageResult;
import com.minicall.domain.dto.CallSessionDto;
import com.minicall.domain.dto.CallStatsDto;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;

/**
 * 通话会话的用例层：权限校验 + 状态机 + 存储。
 *
 * <p>失败时抛 CallNotFoundException / CallForbiddenException / CallStateConflictException，
 * 由 GlobalExceptionHandler 统一转成 HTTP 状态码。</p>
 */
public interface CallSessionAppService {

    CallSessionDto start(long userId, long conversationId, CallType callType);

    CallSessionDto get(long userId, long callId);

    CallSessionDto accept(long userId, long callId);

    CallSessionDto reject(long userId, long callId);

    CallSessionDto end(long userId, long callId);

    CallHistoryResponse history(long userId, Long conversationId, CallType callType, CallStatus status, Integer limit, Integer offset);

    CallStatsDto stats(long userId);

    CallMessageResult appendCallMessage(long userId, long callId, CallStatus status, Integer durationSeconds);
}
