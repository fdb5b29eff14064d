package com.minicall.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.minicall.domain.dto.CallStatsDto;
import com.minicall.domain.entity.CallSessionEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface CallSessionMapper extends BaseMapper<CallSessionEntity> {

    @Select("""
            <script>
            select s.*
            from t_call_session s
            join t_conversation_member cm
              on cm.conversation_id = s.conversation_id
             and cm.user_id = #{userId}
            <where>
              <if test="conversationId != null">and s.conversation_id = #{conversationId}</if>
              <if test="callType != null">and s.call_type = #{callType}</if>
              <if test="status != null">and s.status = #{status}</if>
            </where>
            order by s.created_at desc, s.id desc
            limit #{limit} offset #{offset}
            </script>
            """)
    List<CallSessionEntity> selectHistoryForUser(@Param("userId") long userId,
                                                 @Param("conversationId") Long conversationId,
                                                 @Param("callType") Integer callType,
                                                 @Param("status") Integer status,
                                                 @Param("limit") int limit,
                                                 @Param("offset") int offset);

    @Select("""
            <script>
            select count(*)
            from t_call_session s
            join t_conversation_member cm
              on cm.conversation_id = s.conversation_id
             and cm.user_id = #{userId}
            <where>
              <if test="conversationId != null">and s.conversation_id = #{conversationId}</if>
              <if test="callType != null">and s.call_type = #{callType}</if>
              <if test="status != null">and s.status = #{status}</if>
            </where>
            </script>
            """)
    long countHistoryForUser(@Param("userId") long userId,
                             @Param("conversationId") Long conversationId,
                             @Param("callType") Integer callType,
                             @Param("status") Integer status);

    /**
     * 只统计 ended 的时长；missed 按状态计数。
     */
    @Select("""
            select count(*) as total_calls,
                   coalesce(sum(case when s.status = 4 and s.started_at is not null and s.ended_at is not null
                                     then greatest(timestampdiff(second, s.started_at, s.ended_at), 0) else 0 end), 0) as total_duration_seconds,
                   coalesce(sum(case when s.call_type = 2 then 1 else 0 end), 0) as video_calls,
                   coalesce(sum(case when s.call_type = 1 then 1 else 0 end), 0) as voice_calls,
                   coalesce(sum(case when s.status = 5 then 1 else 0 end), 0) as missed_calls,
                   coalesce(sum(case when s.status = 4 then 1 else 0 end), 0) as completed_calls
            from t_call_session s
            join t_conversation_member cm
              on cm.conversation_id = s.conversation_id
             and cm.user_id = #{userId}
            """)
    CallStatsDto selectStatsForUser(@Param("userId") long userId);
}
