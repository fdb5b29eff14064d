package com.minicall.domain.service.impl;

import com.minicall.domain.config.CallMessageProperties;
import com.minicall.domain.entity.CallSessionEntity;
import com.minicall.domain.entity.MessageEntity;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.domain.enums.MessageType;
import com.minicall.domain.mapper.MessageMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CallMessageServiceImplTest {

    private MessageMapper messageMapper;
    private StringRedisTemplate redis;
    private ValueOperations<String, String> ops;
    private CallMessageServiceImpl service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        messageMapper = mock(MessageMapper.class);
        redis = mock(StringRedisTemplate.class);
        ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        service = new CallMessageServiceImpl(messageMapper, redis, new CallMessageProperties(600L, "t:call:msg:"));
    }

    @Test
    void firstClaim_ShouldInsertCallMessage() {
        when(ops.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class))).thenReturn(true);

        assertTrue(service.appendOnce(session(), CallStatus.ENDED, 42, 1L));

        verify(ops).setIfAbsent(eq("t:call:msg:9001:ended"), anyString(), eq(600L), eq(TimeUnit.SECONDS));
        ArgumentCaptor<MessageEntity> captor = ArgumentCaptor.forClass(MessageEntity.class);
        verify(messageMapper).insert(captor.capture());
        MessageEntity msg = captor.getValue();
        assertEquals(MessageType.CALL, msg.getMsgType());
        assertEquals("ended, duration=42", msg.getContent());
        assertEquals(9001L, msg.getCallId());
        assertEquals(77L, msg.getConversationId());
        assertEquals(1L, msg.getFromUserId());
        assertEquals(CallType.VIDEO, msg.getCallType());
        assertEquals(CallStatus.ENDED, msg.getCallStatus());
        assertEquals(42, msg.getDurationSeconds());
    }

    @Test
    void claimedAlready_ShouldSkipInsert() {
        when(ops.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class))).thenReturn(false);

        assertFalse(service.appendOnce(session(), CallStatus.MISSED, 0, 2L));

        verify(messageMapper, never()).insert(any(MessageEntity.class));
    }

    @Test
    void redisDown_ShouldFailOpenAndInsert() {
        when(ops.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class)))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertTrue(service.appendOnce(session(), CallStatus.REJECTED, 0, 2L));

        verify(messageMapper).insert(any(MessageEntity.class));
    }

    @Test
    void duplicateKey_ShouldReportNotAppended() {
        when(ops.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(messageMapper.insert(any(MessageEntity.class))).thenThrow(new DuplicateKeyException("uk_call_status"));

        assertFalse(service.appendOnce(session(), CallStatus.ENDED, 5, 1L));
        verify(redis, never()).delete(anyString());
    }

    @Test
    void insertFailure_ShouldReleaseClaimAndPropagate() {
        when(ops.setIfAbsent(anyString(), anyString(), anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(messageMapper.insert(any(MessageEntity.class))).thenThrow(new DataIntegrityViolationException("boom"));

        assertThrows(DataIntegrityViolationException.class, () -> service.appendOnce(session(), CallStatus.ENDED, 5, 1L));
        verify(redis).delete("t:call:msg:9001:ended");
    }

    @Test
    void nonTerminalStatus_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.appendOnce(session(), CallStatus.ACCEPTED, 0, 1L));
        verify(redis, never()).opsForValue();
    }

    @Test
    void content_ShouldCarryDurationOnlyForEnded() {
        assertEquals("ended, duration=0", CallMessageServiceImpl.content(CallStatus.ENDED, 0));
        assertEquals("missed", CallMessageServiceImpl.content(CallStatus.MISSED, 12));
        assertEquals("rejected", CallMessageServiceImpl.content(CallStatus.REJECTED, 0));
    }

    private static CallSessionEntity session() {
        CallSessionEntity s = new CallSessionEntity();
        s.setId(9001L);
        s.setConversationId(77L);
        s.setCallerUserId(1L);
        s.setCallType(CallType.VIDEO);
        s.setStatus(CallStatus.ENDED);
        s.setChannelName("call_9001");
        return s;
    }
}
