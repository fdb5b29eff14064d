package com.minicall.rtc.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * uid 不在请求里：服务端按登录身份推导，客户端传什么都不认。
 *
 * @param role       publisher / subscriber，空为 publisher
 * @param expireTime 有效期（秒），空或 0 取默认值
 */
public record RtcTokenRequest(
        @NotBlank(message = "missing_channel") String channel,
        String role,
        Long expireTime
) {
}
