package com.minicall.domain.dto;

import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 通话会话的对外视图；客户端 SDK 反序列化同一个类型。
 */
@Data
public class CallSessionDto {
    private Long id;
    private Long conversationId;
    private Long callerUserId;
    private CallType callType;
    private CallStatus status;
    private String channelName;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;
    /** 仅 ended 有意义，其余为 0 */
    private Integer durationSeconds;
}
