package com.minicall.rtc.token;

import java.util.Map;

/**
 * 解析后的 token 字段（时间均为 epoch 秒）。
 */
public record RtcTokenContent(
        String appId,
        long issuedAt,
        long ttlSeconds,
        long salt,
        int serviceType,
        String channel,
        long uid,
        Map<Integer, Long> privileges,
        byte[] signature
) {

    public long expiresAt() {
        return issuedAt + ttlSeconds;
    }

    public boolean hasPrivilege(RtcPrivilege privilege) {
        return privileges.containsKey(privilege.getId());
    }

    public boolean isExpired(long nowEpochSeconds) {
        return nowEpochSeconds >= expiresAt();
    }
}
