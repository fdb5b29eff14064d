package com.minicall.domain.service.impl;

import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.minicall.domain.call.CallStateMachine;
import com.minicall.domain.call.CallTransition;
import com.minicall.domain.dto.CallHistoryResponse;
import com.minicall.domain.dto.CallMessageResult;
import com.minicall.domain.dto.CallSessionDto;
import com.minicall.domain.dto.CallStatsDto;
import com.minicall.domain.entity.CallSessionEntity;
import com.minicall.domain.enums.CallAction;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.domain.exception.CallForbiddenException;
import com.minicall.domain.exception.CallNotFoundException;
import com.minicall.domain.exception.CallStateConflictException;
import com.minicall.domain.service.CallMessageService;
import com.minicall.domain.service.CallSessionAppService;
import com.minicall.domain.service.CallSessionService;
import com.minicall.domain.service.ConversationMemberService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class CallSessionAppServiceImpl implements CallSessionAppService {

    public static final String CHANNEL_PREFIX = "call_";
    public static final String START_LOCK_PREFIX = "call:start:";
    private static final long START_LOCK_TTL_SECONDS = 10;

    private final CallSessionService callSessionService;
    private final ConversationMemberService conversationMemberService;
    private final CallMessageService callMessageService;
    private final Clock clock;
    private final StringRedisTemplate redis;

    @Override
    public CallSessionDto start(long userId, long conversationId, CallType callType) {
        requireMember(conversationId, userId);

        // 同一会话的 findLive + save 串行执行
        String lockKey = START_LOCK_PREFIX + conversationId;
        if (!tryLockStart(lockKey)) {
            log.debug("call start refused (locked): conversationId={}, userId={}", conversationId, userId);
            throw new CallStateConflictException("call_in_progress", CallStatus.RINGING);
        }
        try {
            return createRinging(userId, conversationId, callType);
        } finally {
            unlockStart(lockKey);
        }
    }

    private CallSessionDto createRinging(long userId, long conversationId, CallType callType) {
        CallSessionEntity live = callSessionService.findLive(conversationId);
        if (live != null) {
            throw new CallStateConflictException("call_in_progress", live.getStatus());
        }

        long callId = IdWorker.getId();
        CallSessionEntity s = new CallSessionEntity();
        s.setId(callId);
        s.setConversationId(conversationId);
        s.setCallerUserId(userId);
        s.setCallType(callType == null ? CallType.VOICE : callType);
        s.setStatus(CallStatus.RINGING);
        s.setChannelName(CHANNEL_PREFIX + callId);
        callSessionService.save(s);

        log.info("call started: callId={}, conversationId={}, callerUserId={}, callType={}",
                callId, conversationId, userId, s.getCallType().getDesc());
        return toDto(s);
    }

    private boolean tryLockStart(String key) {
        // Redis 不可用时 fail-open
        try {
            return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(
                    key, String.valueOf(System.currentTimeMillis()), START_LOCK_TTL_SECONDS, TimeUnit.SECONDS));
        } catch (Exception e) {
            log.debug("call start lock failed: key={}, err={}", key, e.toString());
            return true;
        }
    }

    private void unlockStart(String key) {
        try {
            redis.delete(key);
        } catch (Exception e) {
            log.debug("call start unlock failed: key={}, err={}", key, e.toString());
        }
    }

    @Override
    public CallSessionDto get(long userId, long callId) {
        CallSessionEntity s = load(callId);
        requireMember(s.getConversationId(), userId);
        return toDto(s);
    }

    @Override
    public CallSessionDto accept(long userId, long callId) {
        return transition(userId, callId, CallAction.ACCEPT);
    }

    @Override
    public CallSessionDto reject(long userId, long callId) {
        return transition(userId, callId, CallAction.REJECT);
    }

    @Override
    public CallSessionDto end(long userId, long callId) {
        return transition(userId, callId, CallAction.END);
    }

    @Override
    public CallHistoryResponse history(long userId, Long conversationId, CallType callType, CallStatus status, Integer limit, Integer offset) {
        if (conversationId != null) {
            requireMember(conversationId, userId);
        }
        int safeLimit = limit == null ? 20 : Math.min(Math.max(limit, 1), 100);
        int safeOffset = offset == null ? 0 : Math.max(offset, 0);

        List<CallSessionEntity> list = callSessionService.historyForUser(userId, conversationId, callType, status, safeLimit, safeOffset);
        long total = callSessionService.countHistoryForUser(userId, conversationId, callType, status);
        List<CallSessionDto> calls = new ArrayList<>();
        if (list != null) {
            for (CallSessionEntity e : list) {
                if (e == null) continue;
                calls.add(toDto(e));
            }
        }
        return new CallHistoryResponse(calls, total);
    }

    @Override
    public CallStatsDto stats(long userId) {
        return callSessionService.statsForUser(userId);
    }

    @Override
    public CallMessageResult appendCallMessage(long userId, long callId, CallStatus status, Integer durationSeconds) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("invalid_call_message_status");
        }
        CallSessionEntity s = load(callId);
        requireMember(s.getConversationId(), userId);
        if (s.getStatus() != status) {
            throw new CallStateConflictException("call_status_mismatch", s.getStatus());
        }

        int duration = 0;
        if (status == CallStatus.ENDED) {
            duration = s.getStartedAt() != null && s.getEndedAt() != null
                    ? CallStateMachine.durationSeconds(s.getStartedAt(), s.getEndedAt())
                    : Math.max(0, durationSeconds == null ? 0 : durationSeconds);
        }
        boolean appended = callMessageService.appendOnce(s, status, duration, userId);
        return new CallMessageResult(callId, status.getDesc(), appended);
    }

    private CallSessionDto transition(long userId, long callId, CallAction action) {
        CallSessionEntity s = load(callId);
        requireMember(s.getConversationId(), userId);

        boolean isCaller = Objects.equals(s.getCallerUserId(), userId);
        if (isCaller && action != CallAction.END) {
            throw new CallForbiddenException("only_callee_can_" + action.name().toLowerCase());
        }

        CallTransition t = CallStateMachine.apply(s.getStatus(), action, isCaller, LocalDateTime.now(clock));
        if (!t.changed()) {
            log.debug("call transition no-op: callId={}, status={}, action={}", callId, s.getStatus().getDesc(), action);
            return toDto(s);
        }

        s.setStatus(t.to());
        if (t.startedAt() != null) {
            s.setStartedAt(t.startedAt());
        }
        if (t.endedAt() != null) {
            s.setEndedAt(t.endedAt());
        }
        callSessionService.updateById(s);

        log.info("call transition: callId={}, userId={}, action={}, from={}, to={}",
                callId, userId, action, t.from().getDesc(), t.to().getDesc());
        return toDto(s);
    }

    private CallSessionEntity load(long callId) {
        CallSessionEntity s = callSessionService.getById(callId);
        if (s == null) {
            throw new CallNotFoundException("call_not_found");
        }
        return s;
    }

    private void requireMember(Long conversationId, long userId) {
        if (conversationId == null || !conversationMemberService.isMember(conversationId, userId)) {
            throw new CallForbiddenException("not_conversation_member");
        }
    }

    static CallSessionDto toDto(CallSessionEntity e) {
        CallSessionDto dto = new CallSessionDto();
        dto.setId(e.getId());
        dto.setConversationId(e.getConversationId());
        dto.setCallerUserId(e.getCallerUserId());
        dto.setCallType(e.getCallType());
        dto.setStatus(e.getStatus());
        dto.setChannelName(e.getChannelName());
        dto.setCreatedAt(e.getCreatedAt());
        dto.setStartedAt(e.getStartedAt());
        dto.setEndedAt(e.getEndedAt());
        dto.setDurationSeconds(e.getStatus() == CallStatus.ENDED
                ? CallStateMachine.durationSeconds(e.getStartedAt(), e.getEndedAt())
                : 0);
        return dto;
    }
}
