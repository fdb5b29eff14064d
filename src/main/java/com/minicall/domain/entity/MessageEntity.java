package com.minicall.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话消息。本服务只写 {@link MessageType#CALL} 类型的通话记录。
 *
 * <p>(call_id, call_status) 唯一，同一通话的同一终态最多一条。</p>
 */
@Data
@TableName("t_message")
public class MessageEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long conversationId;

    private Long fromUserId;

    private MessageType msgType;

    private String content;

    private Long callId;

    private CallType callType;

    private CallStatus callStatus;

    private Integer durationSeconds;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
