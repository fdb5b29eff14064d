package com.minicall.domain.service.impl;

import com.minicall.domain.config.CallMessageProperties;
import com.minicall.domain.entity.CallSessionEntity;
import com.minicall.domain.entity.MessageEntity;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.MessageType;
import com.minicall.domain.mapper.MessageMapper;
import com.minicall.domain.service.CallMessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * 通话记录消息写入。
 *
 * <p>两层去重：Redis SETNX 挡住绝大多数重复请求；t_message 上 (call_id, call_status) 唯一键兜底。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallMessageServiceImpl implements CallMessageService {

    private final MessageMapper messageMapper;
    private final StringRedisTemplate redis;
    private final CallMessageProperties props;

    @Override
    public boolean appendOnce(CallSessionEntity session, CallStatus status, int durationSeconds, long fromUserId) {
        if (session == null || session.getId() == null) {
            throw new IllegalArgumentException("missing_call");
        }
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("invalid_call_message_status");
        }
        int duration = Math.max(0, durationSeconds);
        String key = props.redisKeyPrefixEffective() + session.getId() + ":" + status.getDesc();
        if (!tryClaim(key)) {
            log.debug("call message skipped (dedup): callId={}, status={}", session.getId(), status.getDesc());
            return false;
        }

        MessageEntity msg = new MessageEntity();
        msg.setConversationId(session.getConversationId());
        msg.setFromUserId(fromUserId);
        msg.setMsgType(MessageType.CALL);
        msg.setContent(content(status, duration));
        msg.setCallId(session.getId());
        msg.setCallType(session.getCallType());
        msg.setCallStatus(status);
        msg.setDurationSeconds(duration);
        try {
            messageMapper.insert(msg);
        } catch (DuplicateKeyException e) {
            log.debug("call message skipped (duplicate key): callId={}, status={}", session.getId(), status.getDesc());
            return false;
        } catch (RuntimeException e) {
            release(key);
            throw e;
        }
        log.info("call message appended: callId={}, conversationId={}, status={}, duration={}",
                session.getId(), session.getConversationId(), status.getDesc(), duration);
        return true;
    }

    /**
     * 会话里展示的文本，例如 "ended, duration=42"。
     */
    public static String content(CallStatus status, int durationSeconds) {
        if (status == CallStatus.ENDED) {
            return status.getDesc() + ", duration=" + durationSeconds;
        }
        return status.getDesc();
    }

    private boolean tryClaim(String key) {
        // Redis 不可用时 fail-open：交给唯一键兜底
        try {
            return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(
                    key, String.valueOf(System.currentTimeMillis()), props.dedupTtlSecondsEffective(), TimeUnit.SECONDS));
        } catch (Exception e) {
            log.debug("call message dedup claim failed: key={}, err={}", key, e.toString());
            return true;
        }
    }

    private void release(String key) {
        try {
            redis.delete(key);
        } catch (Exception e) {
            log.debug("call message dedup release failed: key={}, err={}", key, e.toString());
        }
    }
}
