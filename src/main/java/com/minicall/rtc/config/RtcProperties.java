package com.minicall.rtc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 媒体中继（relay）的签名配置。
 *
 * <p>appId / appCertificate 缺失时不在启动期失败：签发时抛 {@code RtcConfigException}，
 * 这样没有配置中继的环境仍可启动并提供通话记录查询。</p>
 */
@ConfigurationProperties(prefix = "call.rtc")
public record RtcProperties(
        String appId,
        String appCertificate,
        Long defaultTtlSeconds,
        Long maxTtlSeconds
) {

    public long defaultTtlSecondsEffective() {
        Long v = defaultTtlSeconds;
        if (v == null || v <= 0) {
            return 3600;
        }
        return v;
    }

    public long maxTtlSecondsEffective() {
        Long v = maxTtlSeconds;
        if (v == null || v <= 0) {
            return 86_400;
        }
        return Math.max(v, defaultTtlSecondsEffective());
    }
}
