package com.minicall.client.signal;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.minicall.domain.enums.CallStatus;

import java.time.Duration;

/**
 * 基于 Caffeine 的通话记录消息去重：用 (callId + status) 作为 key。
 *
 * <p>只挡住本客户端的重复发送；跨客户端由服务端 Redis + 唯一键保证。</p>
 */
public class CallMessageDedup {

    private final Cache<String, Boolean> cache;

    public CallMessageDedup(Duration ttl, long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maximumSize))
                .expireAfterWrite(ttl == null || ttl.isZero() || ttl.isNegative() ? Duration.ofHours(1) : ttl)
                .build();
    }

    public static String key(long callId, CallStatus status) {
        return callId + "-" + (status == null ? "" : status.getDesc());
    }

    /**
     * @return true 表示第一次见到这个 key，调用方可以发送
     */
    public boolean markIfAbsent(long callId, CallStatus status) {
        return cache.asMap().putIfAbsent(key(callId, status), Boolean.TRUE) == null;
    }

    public boolean contains(long callId, CallStatus status) {
        return cache.getIfPresent(key(callId, status)) != null;
    }
}
