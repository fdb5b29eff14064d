package com.minicall.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_call_session")
public class CallSessionEntity {

    /** callId，插入前由 IdWorker 生成（channelName 依赖它） */
    @TableId(value = "id", type = IdType.INPUT)
    private Long id;

    private Long conversationId;

    private Long callerUserId;

    /** 见 {@link CallType}（数据库存数字） */
    private CallType callType;

    /** 见 {@link CallStatus}（数据库存数字） */
    private CallStatus status;

    /** "call_" + id，创建后不再变化 */
    private String channelName;

    private LocalDateTime startedAt;

    private LocalDateTime endedAt;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
