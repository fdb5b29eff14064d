package com.minicall.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.minicall.domain.entity.ConversationMemberEntity;

public interface ConversationMemberMapper extends BaseMapper<ConversationMemberEntity> {
}
