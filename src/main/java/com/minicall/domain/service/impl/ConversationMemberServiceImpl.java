package com.minicall.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.minicall.domain.entity.ConversationMemberEntity;
import com.minicall.domain.mapper.ConversationMemberMapper;
import com.minicall.domain.service.ConversationMemberService;
import org.springframework.stereotype.Service;

@Service
public class ConversationMemberServiceImpl extends ServiceImpl<ConversationMemberMapper, ConversationMemberEntity> implements ConversationMemberService {

    @Override
    public boolean isMember(long conversationId, long userId) {
        return this.count(new LambdaQueryWrapper<ConversationMemberEntity>()
                .eq(ConversationMemberEntity::getConversationId, conversationId)
                .eq(ConversationMemberEntity::getUserId, userId)) > 0;
    }
}
