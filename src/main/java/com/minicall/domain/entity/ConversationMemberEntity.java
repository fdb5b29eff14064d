package com.minicall.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话成员（只读；会话本身由消息服务维护）。
 */
@Data
@TableName("t_conversation_member")
public class ConversationMemberEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long conversationId;

    private Long userId;

    private LocalDateTime createdAt;
}
