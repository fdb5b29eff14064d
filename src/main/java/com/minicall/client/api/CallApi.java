package com.minicall.client.api;

import com.minicall.domain.dto.CallHistoryResponse;
import com.minicall.domain.dto.CallMessageResult;
import com.minicall.domain.dto.CallSessionDto;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;

import java.util.concurrent.CompletableFuture;

/**
 * 通话会话接口（/call/session/**）的客户端视图。
 *
 * <p>所有方法都是异步的；失败时 future 以 {@link CallClientException} 的子类结束。</p>
 */
public interface CallApi {

    CompletableFuture<CallSessionDto> startCall(long conversationId, CallType callType);

    CompletableFuture<CallSessionDto> getCall(long callId);

    /**
     * @param conversationId 为 null 时查当前用户所有会话
     */
    CompletableFuture<CallHistoryResponse> getHistory(Long conversationId, int limit, int offset);

    CompletableFuture<CallSessionDto> accept(long callId);

    CompletableFuture<CallSessionDto> reject(long callId);

    CompletableFuture<CallSessionDto> end(long callId);

    CompletableFuture<CallMessageResult> sendCallMessage(long callId, CallStatus status, Integer durationSeconds);
}
