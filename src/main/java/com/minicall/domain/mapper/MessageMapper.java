package com.minicall.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.minicall.domain.entity.MessageEntity;

public interface MessageMapper extends BaseMapper<MessageEntity> {
}
