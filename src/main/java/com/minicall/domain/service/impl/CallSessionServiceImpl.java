package com.minicall.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.minicall.domain.dto.CallStatsDto;
import com.minicall.domain.entity.CallSessionEntity;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.enums.CallType;
import com.minicall.domain.mapper.CallSessionMapper;
import com.minicall.domain.service.CallSessionService;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CallSessionServiceImpl extends ServiceImpl<CallSessionMapper, CallSessionEntity> implements CallSessionService {

    @Override
    public List<CallSessionEntity> historyForUser(long userId, Long conversationId, CallType callType, CallStatus status, int limit, int offset) {
        int safeLimit = Math.min(Math.max(limit, 1), 100);
        int safeOffset = Math.max(offset, 0);
        return this.baseMapper.selectHistoryForUser(userId, conversationId, codeOf(callType), codeOf(status), safeLimit, safeOffset);
    }

    @Override
    public long countHistoryForUser(long userId, Long conversationId, CallType callType, CallStatus status) {
        return this.baseMapper.countHistoryForUser(userId, conversationId, codeOf(callType), codeOf(status));
    }

    @Override
    public CallStatsDto statsForUser(long userId) {
        CallStatsDto stats = this.baseMapper.selectStatsForUser(userId);
        if (stats == null) {
            return new CallStatsDto();
        }
        long completed = stats.getCompletedCalls();
        stats.setAverageDurationSeconds(completed > 0 ? stats.getTotalDurationSeconds() / completed : 0);
        return stats;
    }

    @Override
    public CallSessionEntity findLive(long conversationId) {
        return this.getOne(new LambdaQueryWrapper<CallSessionEntity>()
                .eq(CallSessionEntity::getConversationId, conversationId)
                .in(CallSessionEntity::getStatus, CallStatus.RINGING, CallStatus.ACCEPTED)
                .orderByDesc(CallSessionEntity::getId)
                .last("limit 1"), false);
    }

    private static Integer codeOf(CallType callType) {
        return callType == null ? null : callType.getCode();
    }

    private static Integer codeOf(CallStatus status) {
        return status == null ? null : status.getCode();
    }
}
