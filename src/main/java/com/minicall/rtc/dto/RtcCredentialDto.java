package com.minicall.rtc.dto;

/**
 * 签发结果。token 只用于一次入会，不跨会话复用，也不完整写日志。
 *
 * @param expireTime token 有效期（秒）
 * @param expiresAt  过期时间点（epoch 秒）
 */
public record RtcCredentialDto(
        String appId,
        String token,
        String channel,
        long uid,
        long expireTime,
        long expiresAt
) {

    @Override
    public String toString() {
        return "RtcCredentialDto[appId=" + appId
                + ", token=" + RtcCredentialDto.mask(token)
                + ", channel=" + channel
                + ", uid=" + uid
                + ", expiresAt=" + expiresAt + "]";
    }

    public static String mask(String token) {
        if (token == null) {
            return "null";
        }
        return token.substring(0, Math.min(12, token.length())) + "...(" + token.length() + ")";
    }
}
