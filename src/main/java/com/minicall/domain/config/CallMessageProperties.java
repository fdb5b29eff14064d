package com.minicall.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 通话记录消息写入配置。
 *
 * @param dedupTtlSeconds Redis 去重键存活时间；&lt;=0 时取 86400
 * @param redisKeyPrefix  去重键前缀，完整 key = prefix + callId + ":" + status
 */
@ConfigurationProperties(prefix = "call.message")
public record CallMessageProperties(
        Long dedupTtlSeconds,
        String redisKeyPrefix
) {

    public long dedupTtlSecondsEffective() {
        return dedupTtlSeconds == null || dedupTtlSeconds <= 0 ? 86_400 : dedupTtlSeconds;
    }

    public String redisKeyPrefixEffective() {
        return redisKeyPrefix == null || redisKeyPrefix.isBlank() ? "call:msg:" : redisKeyPrefix;
    }
}
