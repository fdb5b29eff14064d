package com.minicall.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.minicall.domain.entity.ConversationMemberEntity;

public interface ConversationMemberService extends IService<ConversationMemberEntity> {

    boolean isMember(long conversationId, long userId);
}
